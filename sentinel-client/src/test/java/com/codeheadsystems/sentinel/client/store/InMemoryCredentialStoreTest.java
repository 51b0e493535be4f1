package com.codeheadsystems.sentinel.client.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.sentinel.model.store.CredentialDocument;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class InMemoryCredentialStoreTest {

  @Test
  void saveLoadAndClear() {
    InMemoryCredentialStore store = new InMemoryCredentialStore();
    CredentialDocument document = new CredentialDocument(
        "s", "alice@example.com", "tok", "2024-03-01T10:00:00Z", "2024-03-01T11:00:00Z");

    assertThat(store.load()).isEmpty();
    store.save(Optional.of(document));
    assertThat(store.load()).contains(document);
    store.save(Optional.empty());
    assertThat(store.load()).isEmpty();
  }
}

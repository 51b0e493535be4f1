package com.codeheadsystems.sentinel.client.store;

import com.codeheadsystems.sentinel.model.store.CredentialDocument;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link CredentialStore}. The document is lost when the process exits.
 * Suitable for tests and for processes that must not write credentials to disk.
 */
public class InMemoryCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStore.class);

  private final AtomicReference<CredentialDocument> document = new AtomicReference<>();

  @Override
  public void save(final Optional<CredentialDocument> document) {
    this.document.set(document.orElse(null));
    log.debug("save(present={})", document.isPresent());
  }

  @Override
  public Optional<CredentialDocument> load() {
    return Optional.ofNullable(document.get());
  }
}

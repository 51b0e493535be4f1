package com.codeheadsystems.sentinel.client.store;

import com.codeheadsystems.sentinel.model.store.CredentialDocument;
import java.util.Optional;

/**
 * Durable home for the single persisted session document.
 * <p>
 * Only the session controller writes. Writes overwrite; the last one wins.
 * <p>
 * <strong>Corruption contract:</strong> {@link #load()} never throws for missing, unreadable or
 * malformed data. It logs and returns empty, so a damaged store degrades to "logged out"
 * instead of breaking start-up.
 */
public interface CredentialStore {

  /**
   * Replaces the stored document. An empty optional erases it.
   *
   * @param document the document to keep, or empty to clear
   */
  void save(Optional<CredentialDocument> document);

  /**
   * Reads the stored document.
   *
   * @return the document, or empty if there is none or it cannot be read
   */
  Optional<CredentialDocument> load();
}

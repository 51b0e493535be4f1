package com.codeheadsystems.sentinel.client.store;

import com.codeheadsystems.sentinel.model.store.CredentialDocument;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CredentialStore} that keeps the document as JSON in a single file.
 * <p>
 * Saves write a sibling temporary file and move it over the target, so a crash mid-write
 * leaves either the old document or the new one, never a torn file. Clearing deletes the file.
 */
public class FileCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(FileCredentialStore.class);

  private final Path path;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new File credential store.
   *
   * @param path         the file holding the document; its parent directory is created on save
   * @param objectMapper the object mapper
   */
  public FileCredentialStore(final Path path, final ObjectMapper objectMapper) {
    log.info("FileCredentialStore({})", path);
    this.path = path;
    this.objectMapper = objectMapper;
  }

  @Override
  public void save(final Optional<CredentialDocument> document) {
    log.debug("save(present={})", document.isPresent());
    try {
      if (document.isEmpty()) {
        Files.deleteIfExists(path);
        return;
      }
      Path parent = path.toAbsolutePath().getParent();
      Files.createDirectories(parent);
      Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
      try {
        objectMapper.writeValue(temp.toFile(), document.get());
        move(temp);
      } finally {
        Files.deleteIfExists(temp);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write credential store " + path, e);
    }
  }

  @Override
  public Optional<CredentialDocument> load() {
    if (!Files.isRegularFile(path)) {
      log.debug("load(): no document at {}", path);
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(objectMapper.readValue(path.toFile(), CredentialDocument.class));
    } catch (IOException e) {
      log.warn("Ignoring unreadable credential store {}: {}", path, e.getMessage());
      return Optional.empty();
    }
  }

  private void move(final Path temp) throws IOException {
    try {
      Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}

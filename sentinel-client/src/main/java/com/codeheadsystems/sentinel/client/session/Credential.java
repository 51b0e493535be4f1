package com.codeheadsystems.sentinel.client.session;

import com.codeheadsystems.sentinel.model.store.CredentialDocument;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * An authenticated subject's bearer token plus its validity window.
 *
 * @param subjectId stable identifier of the authenticated user
 * @param email     the email address the user authenticated with
 * @param secret    opaque bearer token
 * @param issuedAt  when the token was received
 * @param expiresAt when the token stops being valid; strictly after {@code issuedAt}
 */
public record Credential(
    String subjectId,
    String email,
    String secret,
    Instant issuedAt,
    Instant expiresAt) {

  /**
   * Validates the credential.
   *
   * @throws IllegalArgumentException if a field is null or the validity window is empty
   */
  public Credential {
    require(subjectId, "subjectId");
    require(email, "email");
    require(secret, "secret");
    require(issuedAt, "issuedAt");
    require(expiresAt, "expiresAt");
    if (!expiresAt.isAfter(issuedAt)) {
      throw new IllegalArgumentException(
          "expiresAt (" + expiresAt + ") must be after issuedAt (" + issuedAt + ")");
    }
  }

  /**
   * Rebuilds a credential from its persisted form.
   *
   * @param document the document
   * @return the credential
   * @throws IllegalArgumentException if a field is missing, a timestamp does not parse, or the
   *                                  validity window is empty
   */
  public static Credential fromDocument(final CredentialDocument document) {
    try {
      return new Credential(document.subjectId(), document.email(), document.secret(),
          Instant.parse(document.issuedAt()), Instant.parse(document.expiresAt()));
    } catch (NullPointerException | DateTimeParseException e) {
      throw new IllegalArgumentException("Malformed credential document: " + e.getMessage(), e);
    }
  }

  /**
   * The persisted form of this credential.
   *
   * @return the document
   */
  public CredentialDocument toDocument() {
    return new CredentialDocument(subjectId, email, secret, issuedAt.toString(), expiresAt.toString());
  }

  /**
   * True while {@code now} is strictly before {@link #expiresAt()}. There is no grace period.
   *
   * @param now the instant to test
   * @return whether the credential is valid at {@code now}
   */
  public boolean isValid(final Instant now) {
    return now.isBefore(expiresAt);
  }

  @Override
  public String toString() {
    return "Credential[subjectId=" + subjectId + ", email=" + email + ", secret=***"
        + ", issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
  }

  private static void require(final Object value, final String name) {
    if (value == null) {
      throw new IllegalArgumentException(name + " is required");
    }
  }
}

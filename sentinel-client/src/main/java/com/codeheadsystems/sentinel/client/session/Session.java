package com.codeheadsystems.sentinel.client.session;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * The process's authentication state: either empty or holding exactly one {@link Credential}.
 * <p>
 * An active session keeps its credential after it expires, until something explicitly clears
 * it; consumers should therefore ask for {@link #token(Instant)} rather than reading the
 * credential's secret directly.
 */
public final class Session {

  private static final Session EMPTY = new Session(null);

  private final Credential credential;

  private Session(final Credential credential) {
    this.credential = credential;
  }

  /**
   * The empty session.
   *
   * @return the session
   */
  public static Session empty() {
    return EMPTY;
  }

  /**
   * An active session holding {@code credential}.
   *
   * @param credential the credential
   * @return the session
   */
  public static Session active(final Credential credential) {
    return new Session(Objects.requireNonNull(credential, "credential"));
  }

  /**
   * Whether a credential is held, regardless of its validity.
   *
   * @return true if active
   */
  public boolean isActive() {
    return credential != null;
  }

  /**
   * The held credential, if any.
   *
   * @return the credential
   */
  public Optional<Credential> credential() {
    return Optional.ofNullable(credential);
  }

  /**
   * Whether the session is active and its credential is valid at {@code now}.
   *
   * @param now the instant to test
   * @return true if the session may be used
   */
  public boolean isValid(final Instant now) {
    return credential != null && credential.isValid(now);
  }

  /**
   * The bearer token to expose to consumers, or empty when the session is empty or expired.
   *
   * @param now the instant to test
   * @return the effective token
   */
  public Optional<String> token(final Instant now) {
    return isValid(now) ? Optional.of(credential.secret()) : Optional.empty();
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof Session other && Objects.equals(credential, other.credential);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(credential);
  }

  @Override
  public String toString() {
    return credential == null ? "Session[empty]" : "Session[active, " + credential + "]";
  }
}

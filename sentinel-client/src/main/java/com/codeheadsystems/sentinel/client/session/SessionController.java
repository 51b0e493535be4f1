package com.codeheadsystems.sentinel.client.session;

import com.codeheadsystems.sentinel.client.accessor.AuthGateway;
import com.codeheadsystems.sentinel.client.clock.SessionClock;
import com.codeheadsystems.sentinel.client.exceptions.AuthGatewayException;
import com.codeheadsystems.sentinel.client.exceptions.AuthenticationException;
import com.codeheadsystems.sentinel.client.exceptions.StaleAuthenticationException;
import com.codeheadsystems.sentinel.client.model.AuthErrorKind;
import com.codeheadsystems.sentinel.client.store.CredentialStore;
import com.codeheadsystems.sentinel.model.CredentialEnvelope;
import com.codeheadsystems.sentinel.model.store.CredentialDocument;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiFunction;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates login, signup, logout and auto-login; the only writer of {@link SessionState}.
 * <p>
 * Every transition is written to the session state first and then mirrored to the
 * {@link CredentialStore}. The {@link TokenLifecycleManager} follows the session state on its
 * own, so a new credential arms the expiry timer as part of {@code set}.
 * <p>
 * <strong>Stale responses:</strong> gateway calls cannot be cancelled, so each login, signup,
 * logout and auto-login takes a new request generation. A gateway response is applied only if
 * its generation is still the latest; otherwise it is discarded and the caller's future fails
 * with {@link StaleAuthenticationException}. A login that resolves after a logout therefore
 * cannot bring the cleared session back.
 * <p>
 * Gateway completions are handed to the {@link SessionClock}'s loop before they touch state;
 * {@link #logout()} and {@link #autoLogin()} must be called on that loop.
 */
@Singleton
public class SessionController {

  private static final Logger log = LoggerFactory.getLogger(SessionController.class);

  private final SessionState sessionState;
  private final CredentialStore credentialStore;
  private final AuthGateway authGateway;
  private final SessionClock clock;
  private final AtomicLong requestGeneration = new AtomicLong();
  private final AtomicBoolean autoLoginAttempted = new AtomicBoolean();

  /**
   * Instantiates a new Session controller.
   *
   * @param sessionState    the session state this controller writes
   * @param credentialStore the durable mirror of the session
   * @param authGateway     the remote auth provider
   * @param clock           the clock and event loop
   */
  @Inject
  public SessionController(final SessionState sessionState,
                           final CredentialStore credentialStore,
                           final AuthGateway authGateway,
                           final SessionClock clock) {
    log.info("SessionController()");
    this.sessionState = sessionState;
    this.credentialStore = credentialStore;
    this.authGateway = authGateway;
    this.clock = clock;
  }

  /**
   * Signs in and, on success, makes the new credential the active session.
   * <p>
   * On failure the future completes with {@link AuthenticationException} and the session is
   * left as it was. Nothing is retried.
   *
   * @param email  the email
   * @param secret the password
   * @return the new credential once it is the active session
   */
  public CompletableFuture<Credential> login(final String email, final String secret) {
    log.debug("login(email={})", email);
    return authenticate(email, secret, authGateway::login);
  }

  /**
   * Registers a new user; same contract as {@link #login(String, String)}.
   *
   * @param email  the email
   * @param secret the password
   * @return the new credential once it is the active session
   */
  public CompletableFuture<Credential> signup(final String email, final String secret) {
    log.debug("signup(email={})", email);
    return authenticate(email, secret, authGateway::signup);
  }

  /**
   * Clears the session and erases the persisted credential. Idempotent. Also supersedes any
   * login or signup still in flight.
   */
  public void logout() {
    long generation = requestGeneration.incrementAndGet();
    log.debug("logout(generation={})", generation);
    sessionState.set(Session.empty());
    persist(Optional.empty());
  }

  /**
   * Restores the persisted credential if it is still valid. Invoke once at process start;
   * later calls are ignored.
   * <p>
   * A valid credential becomes the active session, which arms the expiry timer for the
   * <em>remaining</em> lifetime. An expired or unreadable document is erased.
   */
  public void autoLogin() {
    if (!autoLoginAttempted.compareAndSet(false, true)) {
      log.warn("autoLogin() already ran; ignoring");
      return;
    }
    long generation = requestGeneration.incrementAndGet();
    Optional<CredentialDocument> document = credentialStore.load();
    if (document.isEmpty()) {
      log.debug("autoLogin(generation={}): nothing stored", generation);
      return;
    }
    Credential credential;
    try {
      credential = Credential.fromDocument(document.get());
    } catch (IllegalArgumentException e) {
      log.warn("autoLogin(): discarding stored credential: {}", e.getMessage());
      persist(Optional.empty());
      return;
    }
    Instant now = clock.now();
    if (!credential.isValid(now)) {
      log.info("autoLogin(): stored credential expired at {}", credential.expiresAt());
      persist(Optional.empty());
      return;
    }
    log.info("autoLogin(): restored session for {}", credential.email());
    sessionState.set(Session.active(credential));
    persistCurrent();
  }

  /**
   * The generation of the most recent login, signup, logout or auto-login.
   *
   * @return the request generation
   */
  public long requestGeneration() {
    return requestGeneration.get();
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private CompletableFuture<Credential> authenticate(
      final String email,
      final String secret,
      final BiFunction<String, String, CompletableFuture<CredentialEnvelope>> call) {
    long generation = requestGeneration.incrementAndGet();
    CompletableFuture<Credential> result = new CompletableFuture<>();
    CompletableFuture<CredentialEnvelope> response;
    try {
      response = call.apply(email, secret);
    } catch (RuntimeException e) {
      response = CompletableFuture.failedFuture(e);
    }
    response.whenComplete((envelope, error) ->
        clock.execute(() -> complete(result, generation, envelope, error)));
    return result;
  }

  private void complete(final CompletableFuture<Credential> result,
                        final long generation,
                        final CredentialEnvelope envelope,
                        final Throwable error) {
    if (error != null) {
      Throwable cause = error instanceof CompletionException && error.getCause() != null
          ? error.getCause() : error;
      AuthErrorKind kind = cause instanceof AuthGatewayException gatewayException
          ? AuthErrorKind.fromProviderCode(gatewayException.providerCode())
          : AuthErrorKind.UNKNOWN;
      log.info("Authentication failed: {} ({})", kind, cause.getMessage());
      result.completeExceptionally(new AuthenticationException(kind, cause));
      return;
    }
    long current = requestGeneration.get();
    if (generation != current) {
      log.info("Discarding authentication result from generation {} (current {})", generation, current);
      result.completeExceptionally(new StaleAuthenticationException(generation, current));
      return;
    }
    Credential credential;
    try {
      credential = toCredential(envelope, clock.now());
    } catch (IllegalArgumentException | DateTimeException | ArithmeticException e) {
      log.warn("Rejecting malformed credential envelope: {}", e.getMessage());
      result.completeExceptionally(new AuthenticationException(AuthErrorKind.UNKNOWN, e));
      return;
    }
    log.info("Authenticated {}; token valid until {}", credential.email(), credential.expiresAt());
    sessionState.set(Session.active(credential));
    persistCurrent();
    result.complete(credential);
  }

  private Credential toCredential(final CredentialEnvelope envelope, final Instant now) {
    if (envelope == null) {
      throw new IllegalArgumentException("no envelope");
    }
    if (envelope.ttlSeconds() <= 0) {
      throw new IllegalArgumentException("ttlSeconds must be positive, was " + envelope.ttlSeconds());
    }
    return new Credential(envelope.subjectId(), envelope.email(), envelope.secret(),
        now, now.plusSeconds(envelope.ttlSeconds()));
  }

  // The state may already have moved on during set() (an expiry fired synchronously), so
  // mirror what it holds now rather than what was written.
  private void persistCurrent() {
    persist(sessionState.current().credential().map(Credential::toDocument));
  }

  private void persist(final Optional<CredentialDocument> document) {
    try {
      credentialStore.save(document);
    } catch (RuntimeException e) {
      log.warn("Unable to persist session; continuing with in-memory state", e);
    }
  }
}

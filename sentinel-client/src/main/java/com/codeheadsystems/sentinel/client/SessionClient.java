package com.codeheadsystems.sentinel.client;

import com.codeheadsystems.sentinel.client.accessor.AuthGateway;
import com.codeheadsystems.sentinel.client.clock.SessionClock;
import com.codeheadsystems.sentinel.client.config.SessionClientConfig;
import com.codeheadsystems.sentinel.client.guard.AccessGuard;
import com.codeheadsystems.sentinel.client.request.RequestAugmenter;
import com.codeheadsystems.sentinel.client.session.SessionController;
import com.codeheadsystems.sentinel.client.session.SessionState;
import com.codeheadsystems.sentinel.client.session.TokenLifecycleManager;
import com.codeheadsystems.sentinel.client.store.CredentialStore;
import com.codeheadsystems.sentinel.client.store.FileCredentialStore;
import com.codeheadsystems.sentinel.client.store.InMemoryCredentialStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the session core for one process and exposes its hooks.
 * <p>
 * Construct once at start-up, call {@link #start()} (the lifecycle hook, which runs
 * auto-login on the session loop), hand {@link #requestAugmenter()} to the transport and
 * {@link #accessGuard()} to the router, and drive {@link #controller()} from the UI.
 * {@link #close()} cancels the expiry timer; it does not touch the persisted credential.
 */
public class SessionClient implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(SessionClient.class);

  private final SessionClock clock;
  private final SessionState sessionState;
  private final SessionController controller;
  private final TokenLifecycleManager lifecycleManager;
  private final RequestAugmenter requestAugmenter;
  private final AccessGuard accessGuard;

  /**
   * Builds the session core.
   *
   * @param config       the session config
   * @param authGateway  the auth provider
   * @param clock        the clock and event loop
   * @param objectMapper used by the file store
   */
  public SessionClient(final SessionClientConfig config,
                       final AuthGateway authGateway,
                       final SessionClock clock,
                       final ObjectMapper objectMapper) {
    this(config, authGateway, clock, credentialStore(config, objectMapper));
  }

  /**
   * Builds the session core on an explicit store.
   *
   * @param config          the session config
   * @param authGateway     the auth provider
   * @param clock           the clock and event loop
   * @param credentialStore the durable store
   */
  public SessionClient(final SessionClientConfig config,
                       final AuthGateway authGateway,
                       final SessionClock clock,
                       final CredentialStore credentialStore) {
    log.info("SessionClient()");
    this.clock = clock;
    this.sessionState = new SessionState();
    this.controller = new SessionController(sessionState, credentialStore, authGateway, clock);
    this.lifecycleManager = new TokenLifecycleManager(sessionState, clock, controller::logout);
    this.requestAugmenter = new RequestAugmenter(sessionState, clock, config);
    this.accessGuard = new AccessGuard(sessionState, clock, config);
  }

  private static CredentialStore credentialStore(final SessionClientConfig config,
                                                 final ObjectMapper objectMapper) {
    return config.storePath() == null
        ? new InMemoryCredentialStore()
        : new FileCredentialStore(config.storePath(), objectMapper);
  }

  /**
   * Runs auto-login on the session loop.
   *
   * @return completes once auto-login has run
   */
  public CompletableFuture<Void> start() {
    return CompletableFuture.runAsync(controller::autoLogin, clock::execute);
  }

  /**
   * Logs out on the session loop.
   *
   * @return completes once the session is cleared
   */
  public CompletableFuture<Void> logout() {
    return CompletableFuture.runAsync(controller::logout, clock::execute);
  }

  public SessionState sessionState() {
    return sessionState;
  }

  public SessionController controller() {
    return controller;
  }

  public TokenLifecycleManager lifecycleManager() {
    return lifecycleManager;
  }

  public RequestAugmenter requestAugmenter() {
    return requestAugmenter;
  }

  public AccessGuard accessGuard() {
    return accessGuard;
  }

  @Override
  public void close() {
    log.debug("close()");
    clock.execute(lifecycleManager::close);
  }
}

package com.codeheadsystems.sentinel.client.session;

import com.codeheadsystems.sentinel.client.clock.ScheduledTimer;
import com.codeheadsystems.sentinel.client.clock.SessionClock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the single expiry timer for the active credential and drives auto-logout.
 * <p>
 * Follows {@link SessionState}: every transition to an active session replaces the timer
 * with one that fires at the credential's expiry, and every transition to the empty session
 * cancels it. Each cancel or reschedule bumps a generation counter; a timer callback only acts
 * if its generation is still current, so a timer that was cancelled after it had already been
 * queued on the loop is dropped.
 * <p>
 * All methods run on the session loop.
 */
public class TokenLifecycleManager implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(TokenLifecycleManager.class);

  private final SessionClock clock;
  private final Runnable onExpiry;
  private final Subscription subscription;

  private long generation;
  private ScheduledTimer timer;
  private State state = State.IDLE;

  /**
   * Creates the manager and subscribes it to {@code sessionState}. The subscription replays
   * the current value, so a manager created after a session is already active arms at once.
   *
   * @param sessionState the session state to follow
   * @param clock        the clock that owns the timer
   * @param onExpiry     the logout path to run when the credential expires
   */
  public TokenLifecycleManager(final SessionState sessionState,
                               final SessionClock clock,
                               final Runnable onExpiry) {
    log.info("TokenLifecycleManager()");
    this.clock = clock;
    this.onExpiry = onExpiry;
    this.subscription = sessionState.subscribe(this::onSession);
  }

  /**
   * The timer state.
   *
   * @return the state
   */
  public State state() {
    return state;
  }

  /**
   * The current timer generation. Increases on every cancel and reschedule.
   *
   * @return the generation
   */
  public long generation() {
    return generation;
  }

  /**
   * Cancels any outstanding timer and stops following the session state.
   */
  @Override
  public void close() {
    log.debug("close()");
    subscription.unsubscribe();
    cancel();
  }

  private void onSession(final Session session) {
    cancel();
    session.credential().ifPresent(this::arm);
  }

  private void arm(final Credential credential) {
    Instant now = clock.now();
    if (!credential.isValid(now)) {
      log.debug("arm(): credential already expired at {}, logging out", credential.expiresAt());
      fire(generation);
      return;
    }
    long armed = ++generation;
    Duration delay = Duration.between(now, credential.expiresAt());
    state = State.SCHEDULED;
    timer = clock.schedule(delay, () -> fire(armed));
    log.debug("arm(generation={}, delay={})", armed, delay);
  }

  private void cancel() {
    generation++;
    if (timer != null) {
      timer.cancel();
      timer = null;
      state = State.CANCELLED;
      log.debug("cancel(generation={})", generation);
    }
    state = State.IDLE;
  }

  private void fire(final long firedGeneration) {
    if (firedGeneration != generation) {
      log.debug("fire(): dropping stale timer generation={} (current={})", firedGeneration, generation);
      return;
    }
    // Consume this generation so the logout path's own transition cannot fire it again.
    generation++;
    timer = null;
    state = State.FIRED;
    log.info("Credential expired, logging out");
    onExpiry.run();
    if (state == State.FIRED) {
      state = State.IDLE;
    }
  }

  /**
   * Timer states.
   */
  public enum State {
    /** No timer outstanding. */
    IDLE,
    /** A timer is armed for the active credential. */
    SCHEDULED,
    /** The timer fired and the logout path is running. */
    FIRED,
    /** The timer was cancelled; transient on the way back to {@link #IDLE}. */
    CANCELLED
  }
}

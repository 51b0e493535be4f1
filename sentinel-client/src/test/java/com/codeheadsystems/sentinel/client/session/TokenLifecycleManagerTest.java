package com.codeheadsystems.sentinel.client.session;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.sentinel.client.clock.FakeSessionClock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TokenLifecycleManagerTest {

  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  private FakeSessionClock clock;
  private SessionState state;
  private AtomicInteger expiries;
  private TokenLifecycleManager manager;

  @BeforeEach
  void setUp() {
    clock = new FakeSessionClock(T0);
    state = new SessionState();
    expiries = new AtomicInteger();
    // Stands in for the controller's logout path.
    manager = new TokenLifecycleManager(state, clock, () -> {
      expiries.incrementAndGet();
      state.set(Session.empty());
    });
  }

  private static Session activeUntil(final Instant expiresAt) {
    return Session.active(new Credential("s", "alice@example.com", "tok", T0.minusSeconds(1), expiresAt));
  }

  @Test
  void startsIdle() {
    assertThat(manager.state()).isEqualTo(TokenLifecycleManager.State.IDLE);
    assertThat(clock.liveTimers()).isZero();
  }

  @Test
  void active_schedulesTimerAtExpiry() {
    state.set(activeUntil(T0.plusSeconds(3600)));

    assertThat(manager.state()).isEqualTo(TokenLifecycleManager.State.SCHEDULED);
    assertThat(clock.liveTimers()).isEqualTo(1);
    assertThat(clock.nextDue()).isEqualTo(T0.plusSeconds(3600));
  }

  @Test
  void timerFire_logsOutExactlyOnce() {
    state.set(activeUntil(T0.plusSeconds(60)));

    clock.advance(Duration.ofSeconds(59));
    assertThat(expiries).hasValue(0);

    clock.advance(Duration.ofSeconds(1));
    assertThat(expiries).hasValue(1);
    assertThat(state.current()).isEqualTo(Session.empty());
    assertThat(manager.state()).isEqualTo(TokenLifecycleManager.State.IDLE);

    clock.advance(Duration.ofHours(1));
    assertThat(expiries).hasValue(1);
  }

  @Test
  void empty_cancelsTimer() {
    state.set(activeUntil(T0.plusSeconds(60)));

    state.set(Session.empty());
    clock.advance(Duration.ofMinutes(5));

    assertThat(manager.state()).isEqualTo(TokenLifecycleManager.State.IDLE);
    assertThat(clock.liveTimers()).isZero();
    assertThat(expiries).hasValue(0);
  }

  @Test
  void newCredential_replacesTimer_keepingAtMostOneLive() {
    state.set(activeUntil(T0.plusSeconds(60)));
    state.set(activeUntil(T0.plusSeconds(600)));

    assertThat(clock.liveTimers()).isEqualTo(1);
    assertThat(clock.nextDue()).isEqualTo(T0.plusSeconds(600));

    clock.advance(Duration.ofSeconds(61));
    assertThat(expiries).hasValue(0);
    clock.advance(Duration.ofSeconds(600));
    assertThat(expiries).hasValue(1);
  }

  @Test
  void alreadyExpiredCredential_firesSynchronously() {
    state.set(activeUntil(T0));

    assertThat(expiries).hasValue(1);
    assertThat(state.current()).isEqualTo(Session.empty());
    assertThat(clock.liveTimers()).isZero();
  }

  @Test
  void cancelledTimerThatStillRuns_isDroppedByGeneration() {
    state.set(activeUntil(T0.plusSeconds(60)));
    long armedGeneration = manager.generation();

    state.set(Session.empty());
    clock.runAllTimersIgnoringCancellation();

    assertThat(manager.generation()).isGreaterThan(armedGeneration);
    assertThat(expiries).hasValue(0);
  }

  @Test
  void supersededTimerThatStillRuns_isDropped() {
    state.set(activeUntil(T0.plusSeconds(60)));
    state.set(activeUntil(T0.plusSeconds(600)));

    // Runs both the cancelled first timer and the live second one.
    clock.runAllTimersIgnoringCancellation();

    assertThat(expiries).hasValue(1);
  }

  @Test
  void close_cancelsTimerAndStopsFollowing() {
    state.set(activeUntil(T0.plusSeconds(60)));

    manager.close();
    clock.advance(Duration.ofMinutes(5));
    state.set(activeUntil(T0.plusSeconds(3600)));

    assertThat(expiries).hasValue(0);
    assertThat(clock.liveTimers()).isZero();
  }

  @Test
  void lateManager_armsForAlreadyActiveSession() {
    SessionState other = new SessionState();
    other.set(activeUntil(T0.plusSeconds(30)));

    TokenLifecycleManager late = new TokenLifecycleManager(other, clock, expiries::incrementAndGet);

    assertThat(late.state()).isEqualTo(TokenLifecycleManager.State.SCHEDULED);
    clock.advance(Duration.ofSeconds(30));
    assertThat(expiries).hasValue(1);
  }
}

package com.codeheadsystems.sentinel.client.clock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SessionClock} backed by a single-threaded {@link ScheduledExecutorService}.
 * <p>
 * The executor's one daemon thread is the session event loop. Tasks that throw are logged
 * and do not kill the loop.
 */
public class ExecutorSessionClock implements SessionClock, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ExecutorSessionClock.class);

  private final Clock clock;
  private final ScheduledExecutorService executor;

  /**
   * Creates a clock on the system UTC time source.
   */
  public ExecutorSessionClock() {
    this(Clock.systemUTC());
  }

  /**
   * Creates a clock on the given time source.
   *
   * @param clock the time source
   */
  public ExecutorSessionClock(final Clock clock) {
    log.info("ExecutorSessionClock()");
    this.clock = clock;
    this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
      Thread thread = new Thread(runnable, "sentinel-session-loop");
      thread.setDaemon(true);
      return thread;
    });
  }

  @Override
  public Instant now() {
    return clock.instant();
  }

  @Override
  public ScheduledTimer schedule(final Duration delay, final Runnable task) {
    ScheduledFuture<?> future = executor.schedule(guarded(task), delayMillis(delay), TimeUnit.MILLISECONDS);
    return () -> future.cancel(false);
  }

  // Rounded up so a timer never runs before its due instant; saturates for far-future expiries.
  static long delayMillis(final Duration delay) {
    if (delay.isNegative() || delay.isZero()) {
      return 0L;
    }
    try {
      return delay.plusNanos(999_999L).toMillis();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  @Override
  public void execute(final Runnable task) {
    executor.execute(guarded(task));
  }

  /**
   * Stops the loop. Pending timers are discarded.
   */
  @Override
  public void close() {
    log.debug("close()");
    executor.shutdownNow();
  }

  private Runnable guarded(final Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (RuntimeException e) {
        log.warn("Session loop task failed", e);
      }
    };
  }
}

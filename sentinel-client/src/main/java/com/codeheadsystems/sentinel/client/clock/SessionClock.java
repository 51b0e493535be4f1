package com.codeheadsystems.sentinel.client.clock;

import java.time.Duration;
import java.time.Instant;

/**
 * Time source and event loop for the session core.
 * <p>
 * Every session mutation runs on the loop this clock owns: scheduled timers fire on it and
 * asynchronous gateway completions are handed back to it through {@link #execute(Runnable)}.
 * That confinement is what lets session state go without locks.
 */
public interface SessionClock {

  /**
   * The current instant.
   *
   * @return now
   */
  Instant now();

  /**
   * Schedules {@code task} to run on the loop after {@code delay}.
   *
   * @param delay the delay, zero or positive
   * @param task  the task
   * @return a handle that cancels the task
   */
  ScheduledTimer schedule(Duration delay, Runnable task);

  /**
   * Runs {@code task} on the loop as soon as possible.
   *
   * @param task the task
   */
  void execute(Runnable task);
}

package com.codeheadsystems.sentinel.client.clock;

/**
 * Handle to a callback scheduled with {@link SessionClock#schedule}.
 */
public interface ScheduledTimer {

  /**
   * Cancels the timer. Calling this more than once, or after the timer fired, has no effect.
   */
  void cancel();
}

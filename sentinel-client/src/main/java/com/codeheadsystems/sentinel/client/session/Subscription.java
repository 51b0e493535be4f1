package com.codeheadsystems.sentinel.client.session;

/**
 * Registration of a {@link SessionObserver}.
 */
@FunctionalInterface
public interface Subscription {

  /**
   * Stops delivery to the observer. Idempotent.
   */
  void unsubscribe();
}

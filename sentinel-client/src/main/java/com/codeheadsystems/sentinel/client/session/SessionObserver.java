package com.codeheadsystems.sentinel.client.session;

/**
 * Receives every value held by {@link SessionState}, starting with the value current at
 * subscription time.
 */
@FunctionalInterface
public interface SessionObserver {

  /**
   * Called on the session loop with the new value.
   *
   * @param session the session
   */
  void onSession(Session session);
}

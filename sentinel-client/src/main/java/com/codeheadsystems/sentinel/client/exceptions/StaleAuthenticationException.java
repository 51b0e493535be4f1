package com.codeheadsystems.sentinel.client.exceptions;

/**
 * A login or signup succeeded at the provider, but a later login, signup or logout had
 * already been issued by the time the response arrived, so the result was discarded.
 */
public class StaleAuthenticationException extends RuntimeException {
  /**
   * Instantiates a new Stale authentication exception.
   *
   * @param requestGeneration the generation the request was issued under
   * @param currentGeneration the generation current when the response arrived
   */
  public StaleAuthenticationException(final long requestGeneration, final long currentGeneration) {
    super("Discarded authentication result from request generation " + requestGeneration
        + "; current generation is " + currentGeneration);
  }
}

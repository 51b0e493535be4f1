package com.codeheadsystems.sentinel.client.exceptions;

/**
 * The auth provider could not be reached, or answered with something unreadable.
 */
public class GatewayAccessorException extends RuntimeException {
  /**
   * Instantiates a new Gateway accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public GatewayAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}

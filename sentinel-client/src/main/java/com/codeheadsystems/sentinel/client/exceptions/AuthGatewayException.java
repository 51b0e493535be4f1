package com.codeheadsystems.sentinel.client.exceptions;

/**
 * The auth provider rejected a login or signup and said why.
 */
public class AuthGatewayException extends RuntimeException {

  private final int statusCode;
  private final String providerCode;

  /**
   * Instantiates a new Auth gateway exception.
   *
   * @param statusCode   the HTTP status the provider answered with
   * @param providerCode the provider's error code, may be null
   */
  public AuthGatewayException(final int statusCode, final String providerCode) {
    super("Auth provider returned HTTP " + statusCode + " (" + providerCode + ")");
    this.statusCode = statusCode;
    this.providerCode = providerCode;
  }

  public int statusCode() {
    return statusCode;
  }

  public String providerCode() {
    return providerCode;
  }
}

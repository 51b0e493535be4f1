package com.codeheadsystems.sentinel.client.model;

import java.util.Map;

/**
 * Stable failure kinds for login and signup, independent of the provider's own codes.
 */
public enum AuthErrorKind {
  EMAIL_ALREADY_REGISTERED("This email exists already"),
  EMAIL_NOT_FOUND("This email does not exist"),
  INVALID_CREDENTIAL("This password is not correct"),
  UNKNOWN("An unknown error occurred");

  private static final Map<String, AuthErrorKind> PROVIDER_CODES = Map.of(
      "EMAIL_EXISTS", EMAIL_ALREADY_REGISTERED,
      "EMAIL_NOT_FOUND", EMAIL_NOT_FOUND,
      "INVALID_PASSWORD", INVALID_CREDENTIAL,
      "INVALID_LOGIN_CREDENTIALS", INVALID_CREDENTIAL);

  private final String defaultMessage;

  AuthErrorKind(final String defaultMessage) {
    this.defaultMessage = defaultMessage;
  }

  /**
   * Maps a provider error code to a kind. Unrecognised or missing codes map to {@link #UNKNOWN}.
   *
   * @param providerCode the provider's code, may be null
   * @return the kind
   */
  public static AuthErrorKind fromProviderCode(final String providerCode) {
    if (providerCode == null) {
      return UNKNOWN;
    }
    return PROVIDER_CODES.getOrDefault(providerCode, UNKNOWN);
  }

  /**
   * A message suitable for showing to the user.
   *
   * @return the message
   */
  public String defaultMessage() {
    return defaultMessage;
  }
}

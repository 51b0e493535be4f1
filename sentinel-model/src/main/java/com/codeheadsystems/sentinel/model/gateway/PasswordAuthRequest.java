package com.codeheadsystems.sentinel.model.gateway;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of an email/password signup or sign-in call against an identity-toolkit provider.
 * <p>
 * Used by: {@code POST /accounts:signUp} and {@code POST /accounts:signInWithPassword}
 *
 * @param email             the user's email address
 * @param password          the user's password, sent as-is over the (encrypted) transport
 * @param returnSecureToken always {@code true}; asks the provider to return an ID token
 */
public record PasswordAuthRequest(
    @JsonProperty("email") String email,
    @JsonProperty("password") String password,
    @JsonProperty("returnSecureToken") boolean returnSecureToken) {

  /**
   * Instantiates a new request that asks for a secure token.
   *
   * @param email    the email
   * @param password the password
   */
  public PasswordAuthRequest(String email, String password) {
    this(email, password, true);
  }

  @Override
  public String toString() {
    return "PasswordAuthRequest[email=" + email + ", password=***]";
  }
}

package com.codeheadsystems.sentinel.client.exceptions;

import com.codeheadsystems.sentinel.client.model.AuthErrorKind;

/**
 * A login or signup failed. The session state was left untouched.
 */
public class AuthenticationException extends RuntimeException {

  private final AuthErrorKind kind;

  /**
   * Instantiates a new Authentication exception.
   *
   * @param kind  the mapped failure kind
   * @param cause the underlying gateway or transport failure
   */
  public AuthenticationException(final AuthErrorKind kind, final Throwable cause) {
    super(kind.defaultMessage(), cause);
    this.kind = kind;
  }

  public AuthErrorKind kind() {
    return kind;
  }
}

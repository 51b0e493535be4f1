package com.codeheadsystems.sentinel.client.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AuthErrorKindTest {

  @Test
  void fromProviderCode_mapsKnownCodes() {
    assertThat(AuthErrorKind.fromProviderCode("EMAIL_EXISTS")).isEqualTo(AuthErrorKind.EMAIL_ALREADY_REGISTERED);
    assertThat(AuthErrorKind.fromProviderCode("EMAIL_NOT_FOUND")).isEqualTo(AuthErrorKind.EMAIL_NOT_FOUND);
    assertThat(AuthErrorKind.fromProviderCode("INVALID_PASSWORD")).isEqualTo(AuthErrorKind.INVALID_CREDENTIAL);
    assertThat(AuthErrorKind.fromProviderCode("INVALID_LOGIN_CREDENTIALS"))
        .isEqualTo(AuthErrorKind.INVALID_CREDENTIAL);
  }

  @Test
  void fromProviderCode_unknownOrMissing_isUnknown() {
    assertThat(AuthErrorKind.fromProviderCode("USER_DISABLED")).isEqualTo(AuthErrorKind.UNKNOWN);
    assertThat(AuthErrorKind.fromProviderCode(null)).isEqualTo(AuthErrorKind.UNKNOWN);
  }
}

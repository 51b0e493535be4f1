package com.codeheadsystems.sentinel.model.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful response to a signup or sign-in call.
 * <p>
 * {@code expiresIn} is a decimal string of seconds, as the provider sends it. The refresh
 * token is carried for completeness; this client does not refresh and simply logs the user
 * out when the ID token expires.
 *
 * @param localId      the provider's user identifier
 * @param email        the authenticated email address
 * @param idToken      the bearer token
 * @param refreshToken the refresh token (unused)
 * @param expiresIn    token lifetime in seconds, as a string
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PasswordAuthResponse(
    @JsonProperty("localId") String localId,
    @JsonProperty("email") String email,
    @JsonProperty("idToken") String idToken,
    @JsonProperty("refreshToken") String refreshToken,
    @JsonProperty("expiresIn") String expiresIn) {
}

package com.codeheadsystems.sentinel.client.config;

import com.codeheadsystems.sentinel.client.model.TokenPlacement;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration for the session core and its two consumer hooks.
 * <p>
 * For tests use {@link #forTesting()}, which keeps the credential in memory. For real use
 * {@link #of(Path)} persists the credential at the given path with the defaults below.
 *
 * @param unauthenticatedLanding where the access guard redirects when there is no valid session
 * @param tokenPlacement         where the request augmenter attaches the token
 * @param tokenParameterName     query parameter name used with {@link TokenPlacement#QUERY_PARAMETER}
 * @param storePath              file holding the persisted credential, or null to keep it in memory
 */
public record SessionClientConfig(
    String unauthenticatedLanding,
    TokenPlacement tokenPlacement,
    String tokenParameterName,
    Path storePath) {

  /** Default unauthenticated landing route. */
  public static final String DEFAULT_LANDING = "/auth";
  /** Default query parameter carrying the token. */
  public static final String DEFAULT_TOKEN_PARAMETER = "auth";

  /**
   * Validates the config.
   */
  public SessionClientConfig {
    Objects.requireNonNull(unauthenticatedLanding, "unauthenticatedLanding");
    Objects.requireNonNull(tokenPlacement, "tokenPlacement");
    Objects.requireNonNull(tokenParameterName, "tokenParameterName");
    if (tokenParameterName.isBlank()) {
      throw new IllegalArgumentException("tokenParameterName must not be blank");
    }
  }

  /**
   * Persists at {@code storePath}, redirects to {@value #DEFAULT_LANDING}, and attaches the
   * token as the {@value #DEFAULT_TOKEN_PARAMETER} query parameter.
   *
   * @param storePath the store path
   * @return the session client config
   */
  public static SessionClientConfig of(final Path storePath) {
    return new SessionClientConfig(DEFAULT_LANDING, TokenPlacement.QUERY_PARAMETER,
        DEFAULT_TOKEN_PARAMETER, Objects.requireNonNull(storePath, "storePath"));
  }

  /**
   * In-memory store, bearer header, default landing.
   *
   * @return the session client config
   */
  public static SessionClientConfig forTesting() {
    return new SessionClientConfig(DEFAULT_LANDING, TokenPlacement.HEADER, DEFAULT_TOKEN_PARAMETER, null);
  }

  /**
   * A copy with a different token placement.
   *
   * @param placement the placement
   * @return the session client config
   */
  public SessionClientConfig withTokenPlacement(final TokenPlacement placement) {
    return new SessionClientConfig(unauthenticatedLanding, placement, tokenParameterName, storePath);
  }
}

package com.codeheadsystems.sentinel.client.config;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection details for an identity-toolkit style auth provider.
 *
 * @param baseUri        the provider's API base, e.g. {@code https://identitytoolkit.googleapis.com/v1}
 * @param apiKey         the project API key appended as {@code ?key=}
 * @param requestTimeout per-request timeout
 */
public record GatewayConfig(URI baseUri, String apiKey, Duration requestTimeout) {

  /** The public identity-toolkit endpoint. */
  public static final URI IDENTITY_TOOLKIT = URI.create("https://identitytoolkit.googleapis.com/v1");

  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  /**
   * Validates the config.
   */
  public GatewayConfig {
    Objects.requireNonNull(baseUri, "baseUri");
    Objects.requireNonNull(apiKey, "apiKey");
    Objects.requireNonNull(requestTimeout, "requestTimeout");
    if (apiKey.isBlank()) {
      throw new IllegalArgumentException("apiKey must not be blank");
    }
    if (requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("requestTimeout must be positive");
    }
  }

  /**
   * Config for the public identity-toolkit endpoint.
   *
   * @param apiKey the api key
   * @return the gateway config
   */
  public static GatewayConfig identityToolkit(final String apiKey) {
    return new GatewayConfig(IDENTITY_TOOLKIT, apiKey, DEFAULT_TIMEOUT);
  }

  /**
   * Config for a provider at {@code baseUri}, such as a local emulator.
   *
   * @param baseUri the base uri
   * @param apiKey  the api key
   * @return the gateway config
   */
  public static GatewayConfig of(final URI baseUri, final String apiKey) {
    return new GatewayConfig(baseUri, apiKey, DEFAULT_TIMEOUT);
  }

  /**
   * The signup endpoint.
   *
   * @return the uri
   */
  public URI signupUri() {
    return endpoint("accounts:signUp");
  }

  /**
   * The email/password sign-in endpoint.
   *
   * @return the uri
   */
  public URI loginUri() {
    return endpoint("accounts:signInWithPassword");
  }

  private URI endpoint(final String method) {
    String base = baseUri.toString();
    String separator = base.endsWith("/") ? "" : "/";
    return URI.create(base + separator + method + "?key=" + apiKey);
  }
}

package com.codeheadsystems.sentinel.client.accessor;

import com.codeheadsystems.sentinel.client.config.GatewayConfig;
import com.codeheadsystems.sentinel.client.exceptions.AuthGatewayException;
import com.codeheadsystems.sentinel.client.exceptions.GatewayAccessorException;
import com.codeheadsystems.sentinel.model.CredentialEnvelope;
import com.codeheadsystems.sentinel.model.gateway.ErrorResponse;
import com.codeheadsystems.sentinel.model.gateway.PasswordAuthRequest;
import com.codeheadsystems.sentinel.model.gateway.PasswordAuthResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AuthGateway} for an identity-toolkit style REST provider.
 * <p>
 * Handles request serialization, asynchronous dispatch, status-code checking, and response
 * deserialization for the signup and email/password sign-in endpoints. A 4xx/5xx answer is
 * surfaced as {@link AuthGatewayException} carrying the provider's error code; I/O errors and
 * unreadable bodies as {@link GatewayAccessorException}.
 */
@Singleton
public class HttpAuthGateway implements AuthGateway {

  private static final Logger log = LoggerFactory.getLogger(HttpAuthGateway.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final GatewayConfig config;

  /**
   * Instantiates a new Http auth gateway.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param config       the provider connection details
   */
  @Inject
  public HttpAuthGateway(final HttpClient httpClient,
                         final ObjectMapper objectMapper,
                         final GatewayConfig config) {
    log.info("HttpAuthGateway({})", config.baseUri());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.config = config;
  }

  @Override
  public CompletableFuture<CredentialEnvelope> login(final String email, final String secret) {
    log.debug("login(email={})", email);
    return post(config.loginUri(), new PasswordAuthRequest(email, secret));
  }

  @Override
  public CompletableFuture<CredentialEnvelope> signup(final String email, final String secret) {
    log.debug("signup(email={})", email);
    return post(config.signupUri(), new PasswordAuthRequest(email, secret));
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private CompletableFuture<CredentialEnvelope> post(final URI uri, final PasswordAuthRequest body) {
    HttpRequest request;
    try {
      request = HttpRequest.newBuilder()
          .uri(uri)
          .timeout(config.requestTimeout())
          .header("Content-Type", "application/json")
          .header("Accept", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
          .build();
    } catch (JsonProcessingException e) {
      return CompletableFuture.failedFuture(
          new GatewayAccessorException("Unable to serialize request for " + config.baseUri(), e));
    }
    return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
        .handle((response, error) -> {
          if (error != null) {
            throw new CompletionException(
                new GatewayAccessorException("HTTP request failed for " + config.baseUri(), unwrap(error)));
          }
          return toEnvelope(response);
        });
  }

  private CredentialEnvelope toEnvelope(final HttpResponse<String> response) {
    int status = response.statusCode();
    if (status >= 400) {
      String providerCode = providerCode(response.body());
      log.debug("Provider rejected request: status={}, code={}", status, providerCode);
      throw new AuthGatewayException(status, providerCode);
    }
    PasswordAuthResponse body;
    try {
      body = objectMapper.readValue(response.body(), PasswordAuthResponse.class);
    } catch (JsonProcessingException e) {
      throw new GatewayAccessorException("Unreadable response from " + config.baseUri(), e);
    }
    return new CredentialEnvelope(body.localId(), body.email(), body.idToken(), ttlSeconds(body.expiresIn()));
  }

  private String providerCode(final String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(body, ErrorResponse.class).providerCode();
    } catch (JsonProcessingException e) {
      log.debug("Error body is not an error envelope: {}", e.getMessage());
      return null;
    }
  }

  private long ttlSeconds(final String expiresIn) {
    if (expiresIn == null) {
      throw new GatewayAccessorException("Response from " + config.baseUri() + " has no expiresIn", null);
    }
    try {
      return Long.parseLong(expiresIn.trim());
    } catch (NumberFormatException e) {
      throw new GatewayAccessorException("Invalid expiresIn from " + config.baseUri() + ": " + expiresIn, e);
    }
  }

  private static Throwable unwrap(final Throwable error) {
    return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
  }
}

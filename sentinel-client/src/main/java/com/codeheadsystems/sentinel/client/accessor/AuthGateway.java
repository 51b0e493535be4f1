package com.codeheadsystems.sentinel.client.accessor;

import com.codeheadsystems.sentinel.model.CredentialEnvelope;
import java.util.concurrent.CompletableFuture;

/**
 * The remote authentication provider, as seen by the session controller.
 * <p>
 * Both calls complete asynchronously. A provider rejection completes the future with
 * {@link com.codeheadsystems.sentinel.client.exceptions.AuthGatewayException}; a transport
 * failure with {@link com.codeheadsystems.sentinel.client.exceptions.GatewayAccessorException}.
 */
public interface AuthGateway {

  /**
   * Signs in an existing user.
   *
   * @param email  the email
   * @param secret the password
   * @return the credential envelope
   */
  CompletableFuture<CredentialEnvelope> login(String email, String secret);

  /**
   * Registers a new user and signs them in.
   *
   * @param email  the email
   * @param secret the password
   * @return the credential envelope
   */
  CompletableFuture<CredentialEnvelope> signup(String email, String secret);
}

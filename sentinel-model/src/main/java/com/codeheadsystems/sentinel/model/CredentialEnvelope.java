package com.codeheadsystems.sentinel.model;

/**
 * Provider-neutral result of a successful login or signup.
 * <p>
 * The auth gateway translates whatever the remote provider returns into this envelope; the
 * session controller turns it into a credential by anchoring {@code ttlSeconds} at the local
 * clock's current instant.
 *
 * @param subjectId  stable identifier of the authenticated user
 * @param email      the email address the user authenticated with
 * @param secret     opaque bearer token to attach to outgoing requests
 * @param ttlSeconds lifetime of {@code secret}, in seconds, counted from receipt
 */
public record CredentialEnvelope(
    String subjectId,
    String email,
    String secret,
    long ttlSeconds) {
}

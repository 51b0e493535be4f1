package com.codeheadsystems.sentinel.model.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Persisted snapshot of the last active credential.
 * <p>
 * Timestamps are kept as ISO-8601 strings so the document stays readable and so a corrupted
 * value is detected when it is parsed, not when it is read from disk. Validity is never
 * stored; it is re-evaluated against the clock every time the document is loaded.
 *
 * @param subjectId stable identifier of the authenticated user
 * @param email     the email address the user authenticated with
 * @param secret    opaque bearer token
 * @param issuedAt  when the credential was issued, ISO-8601
 * @param expiresAt when the credential expires, ISO-8601
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CredentialDocument(
    @JsonProperty("subjectId") String subjectId,
    @JsonProperty("email") String email,
    @JsonProperty("secret") String secret,
    @JsonProperty("issuedAt") String issuedAt,
    @JsonProperty("expiresAt") String expiresAt) {
}

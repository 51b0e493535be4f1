package com.codeheadsystems.sentinel.client.model;

/**
 * Where the request augmenter puts the bearer token.
 */
public enum TokenPlacement {
  /** {@code Authorization: Bearer <token>}. */
  HEADER,
  /** {@code ?<name>=<token>} appended to the request URI. */
  QUERY_PARAMETER
}

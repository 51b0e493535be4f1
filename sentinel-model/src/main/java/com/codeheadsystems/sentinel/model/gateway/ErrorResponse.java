package com.codeheadsystems.sentinel.model.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error envelope returned by the provider with a 4xx status.
 * <p>
 * Example: {@code {"error": {"code": 400, "message": "EMAIL_EXISTS"}}}. Some messages carry a
 * human-readable suffix after {@code " : "}, e.g. {@code "WEAK_PASSWORD : Password should be at
 * least 6 characters"}; {@link #providerCode()} strips it.
 *
 * @param error the error detail, may be null when the body was not an error envelope
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorResponse(@JsonProperty("error") Detail error) {

  /**
   * Returns the machine-readable provider code, or null if the body carried none.
   *
   * @return the provider code
   */
  public String providerCode() {
    if (error == null || error.message() == null) {
      return null;
    }
    String message = error.message();
    int separator = message.indexOf(" : ");
    return (separator < 0 ? message : message.substring(0, separator)).trim();
  }

  /**
   * Error detail.
   *
   * @param code    the HTTP status echoed by the provider
   * @param message the provider code, optionally followed by a description
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Detail(
      @JsonProperty("code") int code,
      @JsonProperty("message") String message) {
  }
}

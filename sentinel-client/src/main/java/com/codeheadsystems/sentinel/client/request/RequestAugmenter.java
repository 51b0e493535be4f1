package com.codeheadsystems.sentinel.client.request;

import com.codeheadsystems.sentinel.client.clock.SessionClock;
import com.codeheadsystems.sentinel.client.config.SessionClientConfig;
import com.codeheadsystems.sentinel.client.model.TokenPlacement;
import com.codeheadsystems.sentinel.client.session.SessionState;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.function.UnaryOperator;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request pipeline hook that attaches the session token to an outgoing request.
 * <p>
 * Reads the session once per call. Without a valid session the request is returned as-is;
 * with one, a copy carrying the token is returned. {@link HttpRequest} is immutable, so the
 * original stays untouched and can be reused by a retry path.
 */
@Singleton
public class RequestAugmenter implements UnaryOperator<HttpRequest> {

  /** Header used with {@link TokenPlacement#HEADER}. */
  public static final String AUTHORIZATION = "Authorization";

  private static final Logger log = LoggerFactory.getLogger(RequestAugmenter.class);

  private final SessionState sessionState;
  private final SessionClock clock;
  private final TokenPlacement placement;
  private final String parameterName;

  /**
   * Instantiates a new Request augmenter.
   *
   * @param sessionState the session state to read
   * @param clock        the clock validity is judged against
   * @param config       placement settings
   */
  @Inject
  public RequestAugmenter(final SessionState sessionState,
                          final SessionClock clock,
                          final SessionClientConfig config) {
    log.info("RequestAugmenter({})", config.tokenPlacement());
    this.sessionState = sessionState;
    this.clock = clock;
    this.placement = config.tokenPlacement();
    this.parameterName = config.tokenParameterName();
  }

  @Override
  public HttpRequest apply(final HttpRequest request) {
    Optional<String> token = sessionState.current().token(clock.now());
    if (token.isEmpty()) {
      log.debug("apply({}): no valid session, passing through", request.uri());
      return request;
    }
    log.debug("apply({}): attaching token as {}", request.uri(), placement);
    return switch (placement) {
      case HEADER -> HttpRequest.newBuilder(request, (name, value) -> !AUTHORIZATION.equalsIgnoreCase(name))
          .header(AUTHORIZATION, "Bearer " + token.get())
          .build();
      case QUERY_PARAMETER -> HttpRequest.newBuilder(request, (name, value) -> true)
          .uri(withParameter(request.uri(), parameterName, token.get()))
          .build();
    };
  }

  static URI withParameter(final URI uri, final String name, final String value) {
    String text = uri.toString();
    int hash = text.indexOf('#');
    String base = hash < 0 ? text : text.substring(0, hash);
    String fragment = hash < 0 ? "" : text.substring(hash);
    String separator;
    if (uri.getRawQuery() == null) {
      separator = "?";
    } else if (base.endsWith("?") || base.endsWith("&")) {
      separator = "";
    } else {
      separator = "&";
    }
    return URI.create(base + separator
        + URLEncoder.encode(name, StandardCharsets.UTF_8) + "="
        + URLEncoder.encode(value, StandardCharsets.UTF_8) + fragment);
  }
}

package com.codeheadsystems.sentinel.client.guard;

import com.codeheadsystems.sentinel.client.clock.SessionClock;
import com.codeheadsystems.sentinel.client.config.SessionClientConfig;
import com.codeheadsystems.sentinel.client.model.AccessDecision;
import com.codeheadsystems.sentinel.client.session.SessionState;
import java.util.function.Function;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Navigation hook deciding whether a protected route may be entered.
 * <p>
 * Reads the session once per call: a valid session allows, anything else redirects to the
 * configured unauthenticated landing.
 */
@Singleton
public class AccessGuard implements Function<String, AccessDecision> {

  private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

  private final SessionState sessionState;
  private final SessionClock clock;
  private final String landing;

  /**
   * Instantiates a new Access guard.
   *
   * @param sessionState the session state to read
   * @param clock        the clock validity is judged against
   * @param config       supplies the unauthenticated landing
   */
  @Inject
  public AccessGuard(final SessionState sessionState,
                     final SessionClock clock,
                     final SessionClientConfig config) {
    log.info("AccessGuard({})", config.unauthenticatedLanding());
    this.sessionState = sessionState;
    this.clock = clock;
    this.landing = config.unauthenticatedLanding();
  }

  /**
   * Decides whether {@code route} may be entered.
   *
   * @param route the protected route being entered
   * @return {@link AccessDecision.Allow} or {@link AccessDecision.Redirect}
   */
  public AccessDecision authorize(final String route) {
    if (sessionState.current().isValid(clock.now())) {
      return AccessDecision.allow();
    }
    log.debug("authorize({}): no valid session, redirecting to {}", route, landing);
    return AccessDecision.redirect(landing, route);
  }

  @Override
  public AccessDecision apply(final String route) {
    return authorize(route);
  }
}

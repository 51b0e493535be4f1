package com.codeheadsystems.sentinel.client.model;

/**
 * Outcome of asking the access guard whether a protected route may be entered.
 * <p>
 * Either {@link Allow} or {@link Redirect}; a router dispatches on the type because a
 * rejection has to say where to go instead.
 */
public interface AccessDecision {

  /**
   * The allow decision.
   *
   * @return allow
   */
  static AccessDecision allow() {
    return Allow.INSTANCE;
  }

  /**
   * A redirect to {@code target}.
   *
   * @param target         where to send the caller
   * @param requestedRoute the route the caller asked for
   * @return the redirect
   */
  static AccessDecision redirect(final String target, final String requestedRoute) {
    return new Redirect(target, requestedRoute);
  }

  /**
   * Whether the route may be entered.
   *
   * @return true for {@link Allow}
   */
  boolean isAllowed();

  /**
   * The route may be entered.
   */
  enum Allow implements AccessDecision {
    INSTANCE;

    @Override
    public boolean isAllowed() {
      return true;
    }
  }

  /**
   * The route may not be entered; go to {@code target} instead.
   *
   * @param target         the unauthenticated landing route
   * @param requestedRoute the route that was refused, so the caller can come back after login
   */
  record Redirect(String target, String requestedRoute) implements AccessDecision {

    @Override
    public boolean isAllowed() {
      return false;
    }
  }
}

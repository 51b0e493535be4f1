package com.codeheadsystems.sentinel.client.session;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the process's current {@link Session} and broadcasts every change.
 * <p>
 * This is a replay broadcast: a new subscriber is handed the cached value synchronously,
 * before any later change. {@link #current()} is a plain snapshot read and may be called from
 * any thread; {@link #set(Session)} is package-private because {@link SessionController} is
 * the only writer, and it is only ever called on the session loop.
 * <p>
 * If an observer calls back into {@code set} while a value is being delivered, the new value
 * is queued and delivered once every observer has seen the current one. Observers therefore
 * always see transitions in order, and the held value during a notification round is the
 * value being delivered.
 */
@Singleton
public class SessionState {

  private static final Logger log = LoggerFactory.getLogger(SessionState.class);

  private final List<SessionObserver> observers = new CopyOnWriteArrayList<>();
  private final Queue<Session> pending = new ArrayDeque<>();
  private volatile Session current = Session.empty();
  private boolean dispatching;

  /**
   * Instantiates a new, empty session state.
   */
  @Inject
  public SessionState() {
    log.info("SessionState()");
  }

  /**
   * The latest value.
   *
   * @return the session
   */
  public Session current() {
    return current;
  }

  /**
   * Registers {@code observer}, immediately delivers the current value to it, then delivers
   * every later value until unsubscribed.
   *
   * @param observer the observer
   * @return the subscription
   */
  public Subscription subscribe(final SessionObserver observer) {
    Objects.requireNonNull(observer, "observer");
    observers.add(observer);
    log.debug("subscribe(observers={})", observers.size());
    notify(observer, current);
    return () -> {
      if (observers.remove(observer)) {
        log.debug("unsubscribe(observers={})", observers.size());
      }
    };
  }

  void set(final Session session) {
    Objects.requireNonNull(session, "session");
    pending.add(session);
    if (dispatching) {
      log.debug("set() queued behind an in-flight notification");
      return;
    }
    dispatching = true;
    try {
      Session next;
      while ((next = pending.poll()) != null) {
        current = next;
        log.debug("set(active={})", next.isActive());
        for (SessionObserver observer : observers) {
          notify(observer, next);
        }
      }
    } finally {
      dispatching = false;
    }
  }

  private void notify(final SessionObserver observer, final Session session) {
    try {
      observer.onSession(session);
    } catch (RuntimeException e) {
      log.warn("Session observer {} failed", observer, e);
    }
  }
}

package io.b2mash.collab.session;

import io.b2mash.collab.member.User;
import io.b2mash.collab.persistence.PersistenceExecutor;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Persistent session store shared by the REST layer and the realtime handshake. Sessions carry a
 * {@link SessionPrincipal} fixed at login.
 */
@Component
public class SessionStore {

  private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

  private final UserSessionRepository repository;
  private final PersistenceExecutor executor;
  private final SessionProperties properties;
  private final Clock clock;

  @Autowired
  public SessionStore(
      UserSessionRepository repository,
      PersistenceExecutor executor,
      SessionProperties properties) {
    this(repository, executor, properties, Clock.systemUTC());
  }

  SessionStore(
      UserSessionRepository repository,
      PersistenceExecutor executor,
      SessionProperties properties,
      Clock clock) {
    this.repository = repository;
    this.executor = executor;
    this.properties = properties;
    this.clock = clock;
  }

  /** Opens a session for {@code user} and returns its id. */
  public String create(User user) {
    var principal = new SessionPrincipal(user.getId(), user.getUsername());
    var now = clock.instant();
    var sid = SessionTokens.generate();
    executor.runTransactionWithRetry(
        () -> repository.save(new UserSession(sid, principal, now, now.plus(properties.ttl()))),
        "createSession");
    log.info("Opened session for user {}", user.getId());
    return sid;
  }

  /**
   * Looks up the principal for {@code sid}. Unknown, malformed and expired ids resolve to empty;
   * persistence failures propagate.
   */
  public Optional<SessionPrincipal> resolve(String sid) {
    if (!SessionTokens.isWellFormed(sid)) {
      return Optional.empty();
    }
    Instant now = clock.instant();
    return executor
        .executeReadOnly(() -> repository.findById(sid), "resolveSession")
        .filter(session -> !session.isExpiredAt(now))
        .map(UserSession::toPrincipal);
  }

  public void invalidate(String sid) {
    if (!SessionTokens.isWellFormed(sid)) {
      return;
    }
    executor.runTransactionWithRetry(
        () -> {
          if (repository.existsById(sid)) {
            repository.deleteById(sid);
          }
        },
        "invalidateSession");
  }

  @Scheduled(fixedDelayString = "${collab.session.purge-interval-ms:3600000}")
  public void purgeExpired() {
    int purged =
        executor.executeTransactionWithRetry(
            () -> repository.deleteExpired(clock.instant()), "purgeExpiredSessions");
    if (purged > 0) {
      log.info("Purged {} expired session(s)", purged);
    }
  }

  public String cookieName() {
    return properties.cookieName();
  }
}

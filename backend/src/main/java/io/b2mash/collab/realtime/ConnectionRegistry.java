package io.b2mash.collab.realtime;

import io.b2mash.collab.session.SessionPrincipal;
import java.time.Clock;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

/**
 * Live, authenticated connections keyed by transport id. An entry exists only between successful
 * authentication and close/error of its transport. Entries are inserted, replaced and removed
 * whole.
 */
@Component
public class ConnectionRegistry {

  private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

  private final Map<String, RegisteredConnection> connections = new ConcurrentHashMap<>();
  private final Clock clock;

  @Autowired
  public ConnectionRegistry() {
    this(Clock.systemUTC());
  }

  public ConnectionRegistry(Clock clock) {
    this.clock = clock;
  }

  public RegisteredConnection register(
      String connectionId, WebSocketSession session, SessionPrincipal principal) {
    var now = clock.instant();
    var connection = new RegisteredConnection(session, principal, now, now);
    connections.put(connectionId, connection);
    log.info(
        "Realtime connection {} registered for user {} ({} open)",
        connectionId,
        principal.userId(),
        connections.size());
    return connection;
  }

  /** Removes the entry if present. Safe to call repeatedly. */
  public boolean unregister(String connectionId) {
    var removed = connections.remove(connectionId);
    if (removed != null) {
      log.info(
          "Realtime connection {} of user {} removed ({} open)",
          connectionId,
          removed.userId(),
          connections.size());
      return true;
    }
    return false;
  }

  /** Records liveness for a registered connection; unknown ids are ignored. */
  public void touch(String connectionId) {
    var now = clock.instant();
    connections.computeIfPresent(connectionId, (id, connection) -> connection.seenAt(now));
  }

  public boolean isRegistered(String connectionId) {
    return connections.containsKey(connectionId);
  }

  public Optional<RegisteredConnection> find(String connectionId) {
    return Optional.ofNullable(connections.get(connectionId));
  }

  /** Snapshot of all entries, keyed by connection id. */
  public Map<String, RegisteredConnection> snapshot() {
    return Map.copyOf(connections);
  }

  public List<RegisteredConnection> connections() {
    return List.copyOf(connections.values());
  }

  public List<RegisteredConnection> connectionsFor(Collection<Long> userIds) {
    if (userIds.isEmpty()) {
      return List.of();
    }
    Set<Long> targets = new HashSet<>(userIds);
    return connections.values().stream()
        .filter(connection -> targets.contains(connection.userId()))
        .toList();
  }

  public int size() {
    return connections.size();
  }
}

package io.b2mash.collab.realtime;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;

/**
 * Sends protocol-level ping frames to registered connections and drops dead peers: a connection
 * whose ping fails, or that has been silent for longer than the idle limit, is closed and removed.
 */
@Component
public class HeartbeatScheduler {

  private static final Logger log = LoggerFactory.getLogger(HeartbeatScheduler.class);

  private static final CloseStatus IDLE = CloseStatus.GOING_AWAY.withReason("Heartbeat timeout");

  private final ConnectionRegistry registry;
  private final RealtimeProperties properties;
  private final Clock clock;

  @Autowired
  public HeartbeatScheduler(ConnectionRegistry registry, RealtimeProperties properties) {
    this(registry, properties, Clock.systemUTC());
  }

  HeartbeatScheduler(ConnectionRegistry registry, RealtimeProperties properties, Clock clock) {
    this.registry = registry;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(
      fixedRateString = "${collab.realtime.heartbeat-interval-ms:30000}",
      initialDelayString = "${collab.realtime.heartbeat-interval-ms:30000}")
  public void sendHeartbeats() {
    Instant idleCutoff = clock.instant().minus(properties.idleLimit());
    int pinged = 0;
    int dropped = 0;

    for (var entry : registry.snapshot().entrySet()) {
      var connectionId = entry.getKey();
      var connection = entry.getValue();
      var session = connection.session();

      if (!session.isOpen()) {
        registry.unregister(connectionId);
        dropped++;
        continue;
      }
      if (connection.lastSeen().isBefore(idleCutoff)) {
        log.info(
            "Closing idle realtime connection {} of user {}", connectionId, connection.userId());
        drop(connectionId, connection, IDLE);
        dropped++;
        continue;
      }
      try {
        session.sendMessage(new PingMessage(ByteBuffer.allocate(0)));
        pinged++;
      } catch (IOException | RuntimeException e) {
        log.warn("Heartbeat to connection {} failed: {}", connectionId, e.getMessage());
        drop(connectionId, connection, CloseStatus.SESSION_NOT_RELIABLE);
        dropped++;
      }
    }

    if (pinged > 0 || dropped > 0) {
      log.debug("Heartbeat: pinged={}, dropped={}", pinged, dropped);
    }
  }

  private void drop(String connectionId, RegisteredConnection connection, CloseStatus status) {
    registry.unregister(connectionId);
    try {
      connection.session().close(status);
    } catch (IOException e) {
      log.debug("Close of connection {} failed: {}", connectionId, e.getMessage());
    }
  }
}

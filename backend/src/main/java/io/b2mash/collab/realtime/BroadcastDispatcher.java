package io.b2mash.collab.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * Pushes events to registered connections. Delivery is best-effort: a failed send is logged and
 * counted, and never affects other connections or the caller. There is no acknowledgment or
 * replay; clients re-fetch state after reconnecting.
 */
@Component
public class BroadcastDispatcher {

  private static final Logger log = LoggerFactory.getLogger(BroadcastDispatcher.class);

  private final ConnectionRegistry registry;
  private final ObjectMapper objectMapper;

  public BroadcastDispatcher(ConnectionRegistry registry, ObjectMapper objectMapper) {
    this.registry = registry;
    this.objectMapper = objectMapper;
  }

  /** Sends {@code event} to every registered connection. */
  public DeliveryReport broadcast(RealtimeEvent event) {
    return deliver(event, registry.connections());
  }

  /**
   * Sends {@code event} to the connections of the given users, once per connection. Users with no
   * open connection are skipped.
   */
  public DeliveryReport sendToUsers(RealtimeEvent event, Collection<Long> userIds) {
    return deliver(event, registry.connectionsFor(userIds));
  }

  /** Sends to a single transport, registered or not. Returns whether the frame was written. */
  public boolean sendTo(WebSocketSession session, RealtimeEvent event) {
    var frame = serialize(event);
    return frame != null && send(session, frame, event.type());
  }

  private DeliveryReport deliver(RealtimeEvent event, List<RegisteredConnection> targets) {
    if (targets.isEmpty()) {
      log.debug("No open connections for {}", event.type().wireName());
      return DeliveryReport.EMPTY;
    }
    var frame = serialize(event);
    if (frame == null) {
      return new DeliveryReport(targets.size(), 0, targets.size());
    }

    int delivered = 0;
    for (var connection : targets) {
      if (send(connection.session(), frame, event.type())) {
        delivered++;
      }
    }
    int failed = targets.size() - delivered;
    if (failed > 0) {
      log.warn(
          "Delivered {} to {}/{} connection(s)",
          event.type().wireName(),
          delivered,
          targets.size());
    } else {
      log.debug("Delivered {} to {} connection(s)", event.type().wireName(), delivered);
    }
    return new DeliveryReport(targets.size(), delivered, failed);
  }

  private TextMessage serialize(RealtimeEvent event) {
    try {
      return new TextMessage(objectMapper.writeValueAsString(event));
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize realtime event {}", event.type().wireName(), e);
      return null;
    }
  }

  private boolean send(WebSocketSession session, TextMessage frame, EventType type) {
    if (!session.isOpen()) {
      log.debug("Skipping closed connection {} for {}", session.getId(), type.wireName());
      return false;
    }
    try {
      session.sendMessage(frame);
      return true;
    } catch (IOException | RuntimeException e) {
      log.warn(
          "Failed to send {} to connection {}: {}",
          type.wireName(),
          session.getId(),
          e.getMessage());
      return false;
    }
  }
}

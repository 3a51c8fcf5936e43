package io.b2mash.collab.realtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.collab.session.SessionPrincipal;
import io.b2mash.collab.session.SessionStore;
import io.b2mash.collab.session.SessionTokens;
import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Binds realtime transports to authenticated sessions.
 *
 * <p>On open, the session id captured at handshake is checked for shape, then resolved against the
 * {@link SessionStore} off the container thread. Only a resolved principal puts the transport into
 * the {@link ConnectionRegistry}. Transports that are not registered within the auth timeout are
 * closed. Close and transport errors remove the registry entry unconditionally.
 */
@Component
public class RealtimeWebSocketHandler extends TextWebSocketHandler {

  private static final Logger log = LoggerFactory.getLogger(RealtimeWebSocketHandler.class);

  static final CloseStatus NO_SESSION_ID =
      CloseStatus.POLICY_VIOLATION.withReason("No valid session ID");
  static final CloseStatus MALFORMED_SESSION_ID =
      CloseStatus.POLICY_VIOLATION.withReason("Malformed session ID");
  static final CloseStatus UNAUTHORIZED = CloseStatus.POLICY_VIOLATION.withReason("Unauthorized");
  static final CloseStatus AUTH_TIMEOUT =
      CloseStatus.POLICY_VIOLATION.withReason("Authentication timeout");
  static final CloseStatus STORE_FAILURE =
      CloseStatus.SERVER_ERROR.withReason("Internal Server Error");

  private final SessionStore sessionStore;
  private final ConnectionRegistry registry;
  private final BroadcastDispatcher dispatcher;
  private final TaskScheduler scheduler;
  private final ObjectMapper objectMapper;
  private final RealtimeProperties properties;
  private final Map<String, ScheduledFuture<?>> authTimeouts = new ConcurrentHashMap<>();

  public RealtimeWebSocketHandler(
      SessionStore sessionStore,
      ConnectionRegistry registry,
      BroadcastDispatcher dispatcher,
      @Qualifier("taskScheduler") TaskScheduler scheduler,
      ObjectMapper objectMapper,
      RealtimeProperties properties) {
    this.sessionStore = sessionStore;
    this.registry = registry;
    this.dispatcher = dispatcher;
    this.scheduler = scheduler;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    var sid =
        (String)
            session.getAttributes().get(SessionCookieHandshakeInterceptor.SESSION_ID_ATTRIBUTE);
    if (sid == null) {
      log.warn("Realtime connection {} rejected: no session id", session.getId());
      close(session, NO_SESSION_ID);
      return;
    }
    if (!SessionTokens.isWellFormed(sid)) {
      log.warn("Realtime connection {} rejected: malformed session id", session.getId());
      close(session, MALFORMED_SESSION_ID);
      return;
    }

    var decorated =
        new ConcurrentWebSocketSessionDecorator(
            session,
            (int) properties.sendTimeLimit().toMillis(),
            (int) properties.sendBufferLimit().toBytes());
    authTimeouts.put(
        session.getId(),
        scheduler.schedule(
            () -> expireUnauthenticated(session), Instant.now().plus(properties.authTimeout())));
    scheduler.schedule(() -> authenticate(session, decorated, sid), Instant.now());
  }

  void authenticate(WebSocketSession session, WebSocketSession decorated, String sid) {
    Optional<SessionPrincipal> principal;
    try {
      principal = sessionStore.resolve(sid);
    } catch (RuntimeException e) {
      log.error("Session lookup failed for realtime connection {}", session.getId(), e);
      cancelAuthTimeout(session.getId());
      close(session, STORE_FAILURE);
      return;
    }

    if (principal.isEmpty()) {
      log.warn("Realtime connection {} rejected: no session principal", session.getId());
      cancelAuthTimeout(session.getId());
      close(session, UNAUTHORIZED);
      return;
    }
    if (!session.isOpen()) {
      cancelAuthTimeout(session.getId());
      return;
    }

    registry.register(session.getId(), decorated, principal.get());
    cancelAuthTimeout(session.getId());
    if (!session.isOpen()) {
      // closed while registering; afterConnectionClosed may already have run
      registry.unregister(session.getId());
      return;
    }
    dispatcher.sendTo(
        decorated,
        RealtimeEvent.of(
            EventType.CONNECTION_STATUS,
            Map.of("status", "connected", "userId", principal.get().userId())));
  }

  void expireUnauthenticated(WebSocketSession session) {
    authTimeouts.remove(session.getId());
    if (session.isOpen() && !registry.isRegistered(session.getId())) {
      log.warn("Realtime connection {} closed: authentication timed out", session.getId());
      close(session, AUTH_TIMEOUT);
    }
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    var connection = registry.find(session.getId());
    if (connection.isEmpty()) {
      log.debug("Ignoring frame from unauthenticated connection {}", session.getId());
      return;
    }
    registry.touch(session.getId());
    var target = connection.get().session();

    JsonNode payload;
    try {
      payload = objectMapper.readTree(message.getPayload());
    } catch (IOException e) {
      log.warn("Unreadable frame from connection {}: {}", session.getId(), e.getMessage());
      dispatcher.sendTo(
          target,
          RealtimeEvent.of(EventType.ERROR, Map.of("message", "Failed to process message")));
      return;
    }

    var type = payload.path("type").asText("");
    if ("ping".equals(type)) {
      dispatcher.sendTo(target, RealtimeEvent.of(EventType.PONG));
    } else {
      log.debug("Ignoring client frame of type '{}' from connection {}", type, session.getId());
    }
  }

  @Override
  protected void handlePongMessage(WebSocketSession session, PongMessage message) {
    registry.touch(session.getId());
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.warn(
        "Transport error on realtime connection {}: {}", session.getId(), exception.getMessage());
    cancelAuthTimeout(session.getId());
    registry.unregister(session.getId());
    close(session, CloseStatus.SERVER_ERROR);
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    cancelAuthTimeout(session.getId());
    registry.unregister(session.getId());
    log.debug("Realtime connection {} closed with {}", session.getId(), status);
  }

  private void cancelAuthTimeout(String connectionId) {
    var timeout = authTimeouts.remove(connectionId);
    if (timeout != null) {
      timeout.cancel(false);
    }
  }

  private void close(WebSocketSession session, CloseStatus status) {
    if (!session.isOpen()) {
      return;
    }
    try {
      session.close(status);
    } catch (IOException e) {
      log.debug("Close of realtime connection {} failed: {}", session.getId(), e.getMessage());
    }
  }
}

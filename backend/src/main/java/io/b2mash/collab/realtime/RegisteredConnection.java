package io.b2mash.collab.realtime;

import io.b2mash.collab.session.SessionPrincipal;
import java.time.Instant;
import org.springframework.web.socket.WebSocketSession;

/**
 * An open, authenticated transport. {@code session} is the thread-safe decorator used for all
 * sends. Instances are immutable; the registry replaces them whole.
 */
public record RegisteredConnection(
    WebSocketSession session, SessionPrincipal principal, Instant registeredAt, Instant lastSeen) {

  public Long userId() {
    return principal.userId();
  }

  RegisteredConnection seenAt(Instant instant) {
    return new RegisteredConnection(session, principal, registeredAt, instant);
  }
}

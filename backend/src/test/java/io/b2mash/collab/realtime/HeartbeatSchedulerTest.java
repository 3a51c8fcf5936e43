package io.b2mash.collab.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.collab.realtime.ConnectionRegistryTest.MutableClock;
import io.b2mash.collab.session.SessionPrincipal;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.WebSocketSession;

class HeartbeatSchedulerTest {

  private static final SessionPrincipal ALICE = new SessionPrincipal(7L, "alice");

  private MutableClock clock;
  private ConnectionRegistry registry;
  private HeartbeatScheduler heartbeat;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-01-05T10:00:00Z"));
    registry = new ConnectionRegistry(clock);
    var properties =
        new RealtimeProperties(
            "/ws",
            Duration.ofSeconds(10),
            30_000,
            Duration.ofSeconds(10),
            DataSize.ofKilobytes(512),
            List.of("*"));
    heartbeat = new HeartbeatScheduler(registry, properties, clock);
  }

  @Test
  void livePeersArePinged() throws Exception {
    var session = openSession("c1");
    registry.register("c1", session, ALICE);

    heartbeat.sendHeartbeats();

    verify(session).sendMessage(any(PingMessage.class));
    assertThat(registry.isRegistered("c1")).isTrue();
  }

  @Test
  void peerSilentForTwoIntervalsIsClosedAndRemoved() throws Exception {
    var session = openSession("c1");
    registry.register("c1", session, ALICE);

    clock.advanceSeconds(61);
    heartbeat.sendHeartbeats();

    verify(session).close(any(CloseStatus.class));
    verify(session, never()).sendMessage(any());
    assertThat(registry.isRegistered("c1")).isFalse();
  }

  @Test
  void pongKeepsPeerAlive() throws Exception {
    var session = openSession("c1");
    registry.register("c1", session, ALICE);

    clock.advanceSeconds(45);
    registry.touch("c1");
    clock.advanceSeconds(45);
    heartbeat.sendHeartbeats();

    verify(session).sendMessage(any(PingMessage.class));
    assertThat(registry.isRegistered("c1")).isTrue();
  }

  @Test
  void failedPingDropsConnection() throws Exception {
    var session = openSession("c1");
    doThrow(new IOException("broken pipe")).when(session).sendMessage(any());
    registry.register("c1", session, ALICE);

    heartbeat.sendHeartbeats();

    verify(session).close(CloseStatus.SESSION_NOT_RELIABLE);
    assertThat(registry.isRegistered("c1")).isFalse();
  }

  @Test
  void alreadyClosedTransportIsUnregistered() {
    var session = mock(WebSocketSession.class);
    when(session.isOpen()).thenReturn(false);
    registry.register("c1", session, ALICE);

    heartbeat.sendHeartbeats();

    assertThat(registry.size()).isZero();
  }

  private static WebSocketSession openSession(String id) {
    var session = mock(WebSocketSession.class);
    when(session.getId()).thenReturn(id);
    when(session.isOpen()).thenReturn(true);
    return session;
  }
}

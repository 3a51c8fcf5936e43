package io.b2mash.collab.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import io.b2mash.collab.session.SessionPrincipal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.WebSocketSession;

class ConnectionRegistryTest {

  private static final Instant T0 = Instant.parse("2026-01-05T10:00:00Z");

  private final ConnectionRegistry registry =
      new ConnectionRegistry(Clock.fixed(T0, ZoneOffset.UTC));

  @Test
  void registerThenUnregisterRemovesEntry() {
    registry.register("c1", mock(WebSocketSession.class), new SessionPrincipal(7L, "alice"));

    assertThat(registry.isRegistered("c1")).isTrue();
    assertThat(registry.unregister("c1")).isTrue();
    assertThat(registry.isRegistered("c1")).isFalse();
    assertThat(registry.size()).isZero();
  }

  @Test
  void unregisterIsIdempotent() {
    registry.register("c1", mock(WebSocketSession.class), new SessionPrincipal(7L, "alice"));

    assertThat(registry.unregister("c1")).isTrue();
    assertThat(registry.unregister("c1")).isFalse();
    assertThat(registry.unregister("never-registered")).isFalse();
  }

  @Test
  void connectionsForReturnsEveryConnectionOfTargetedUsers() {
    var aliceLaptop = mock(WebSocketSession.class);
    var alicePhone = mock(WebSocketSession.class);
    var bob = mock(WebSocketSession.class);
    registry.register("a1", aliceLaptop, new SessionPrincipal(7L, "alice"));
    registry.register("a2", alicePhone, new SessionPrincipal(7L, "alice"));
    registry.register("b1", bob, new SessionPrincipal(8L, "bob"));

    var targeted = registry.connectionsFor(List.of(7L));

    assertThat(targeted)
        .extracting(RegisteredConnection::session)
        .containsExactlyInAnyOrder(aliceLaptop, alicePhone);
    assertThat(registry.connectionsFor(List.of())).isEmpty();
    assertThat(registry.connectionsFor(List.of(99L))).isEmpty();
  }

  @Test
  void touchUpdatesLastSeenOfRegisteredConnectionOnly() {
    var clock = new MutableClock(T0);
    var registry = new ConnectionRegistry(clock);
    registry.register("c1", mock(WebSocketSession.class), new SessionPrincipal(7L, "alice"));

    clock.advanceSeconds(45);
    registry.touch("c1");
    registry.touch("unknown");

    var connection = registry.find("c1").orElseThrow();
    assertThat(connection.registeredAt()).isEqualTo(T0);
    assertThat(connection.lastSeen()).isEqualTo(T0.plusSeconds(45));
    assertThat(registry.isRegistered("unknown")).isFalse();
  }

  @Test
  void snapshotIsDetachedFromLaterChanges() {
    registry.register("c1", mock(WebSocketSession.class), new SessionPrincipal(7L, "alice"));

    var snapshot = registry.snapshot();
    registry.unregister("c1");

    assertThat(snapshot).containsKey("c1");
    assertThat(registry.snapshot()).isEmpty();
  }

  /** Clock whose instant can be moved forward by the test. */
  static final class MutableClock extends Clock {

    private Instant now;

    MutableClock(Instant start) {
      this.now = start;
    }

    void advanceSeconds(long seconds) {
      now = now.plusSeconds(seconds);
    }

    @Override
    public ZoneOffset getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}

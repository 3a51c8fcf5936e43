package io.b2mash.collab.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.collab.session.SessionPrincipal;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

class BroadcastDispatcherTest {

  private ConnectionRegistry registry;
  private BroadcastDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    registry = new ConnectionRegistry();
    dispatcher = new BroadcastDispatcher(registry, new ObjectMapper());
  }

  @Test
  void sendToUsersReachesExactlyTheTargetUsersConnections() throws Exception {
    var userLaptop = openSession("u1");
    var userPhone = openSession("u2");
    var otherUser = openSession("o1");
    registry.register("u1", userLaptop, new SessionPrincipal(7L, "alice"));
    registry.register("u2", userPhone, new SessionPrincipal(7L, "alice"));
    registry.register("o1", otherUser, new SessionPrincipal(8L, "bob"));

    var report =
        dispatcher.sendToUsers(
            RealtimeEvent.of(EventType.TASK_DUE_DATE_UPDATED, Map.of("taskId", 1)), List.of(7L));

    assertThat(report).isEqualTo(new DeliveryReport(2, 2, 0));
    verify(userLaptop).sendMessage(any(TextMessage.class));
    verify(userPhone).sendMessage(any(TextMessage.class));
    verify(otherUser, never()).sendMessage(any());
  }

  @Test
  void broadcastSerializesTypeAndData() throws Exception {
    var session = openSession("c1");
    registry.register("c1", session, new SessionPrincipal(7L, "alice"));

    dispatcher.broadcast(
        RealtimeEvent.of(EventType.TASK_DELETED, Map.of("taskId", 12, "deletedBy", 7)));

    var frame = ArgumentCaptor.forClass(TextMessage.class);
    verify(session).sendMessage(frame.capture());
    var json = new ObjectMapper().readTree(frame.getValue().getPayload());
    assertThat(json.get("type").asText()).isEqualTo("task_deleted");
    assertThat(json.get("data").get("taskId").asInt()).isEqualTo(12);
  }

  @Test
  void failedSendIsCountedAndDoesNotStopOtherConnections() throws Exception {
    var broken = openSession("b1");
    doThrow(new IOException("broken pipe")).when(broken).sendMessage(any());
    var healthy = openSession("h1");
    registry.register("b1", broken, new SessionPrincipal(7L, "alice"));
    registry.register("h1", healthy, new SessionPrincipal(8L, "bob"));

    var report = dispatcher.broadcast(RealtimeEvent.of(EventType.TASK_CREATED, Map.of("id", 1)));

    assertThat(report).isEqualTo(new DeliveryReport(2, 1, 1));
    verify(healthy).sendMessage(any(TextMessage.class));
  }

  @Test
  void closedConnectionsAreSkipped() throws Exception {
    var closed = mock(WebSocketSession.class);
    when(closed.getId()).thenReturn("c1");
    when(closed.isOpen()).thenReturn(false);
    registry.register("c1", closed, new SessionPrincipal(7L, "alice"));

    var report = dispatcher.sendToUsers(RealtimeEvent.of(EventType.PONG), List.of(7L));

    assertThat(report.failed()).isEqualTo(1);
    verify(closed, never()).sendMessage(any());
  }

  @Test
  void noOpenConnectionsYieldsEmptyReport() {
    assertThat(dispatcher.sendToUsers(RealtimeEvent.of(EventType.PONG), List.of(7L)))
        .isEqualTo(DeliveryReport.EMPTY);
  }

  private static WebSocketSession openSession(String id) {
    var session = mock(WebSocketSession.class);
    when(session.getId()).thenReturn(id);
    when(session.isOpen()).thenReturn(true);
    return session;
  }
}

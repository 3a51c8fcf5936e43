package io.b2mash.collab.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.collab.session.SessionPrincipal;
import io.b2mash.collab.session.SessionStore;
import io.b2mash.collab.session.SessionTokens;
import java.io.EOFException;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.util.unit.DataSize;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

class RealtimeWebSocketHandlerTest {

  private static final SessionPrincipal ALICE = new SessionPrincipal(7L, "alice");

  private SessionStore sessionStore;
  private ConnectionRegistry registry;
  private BroadcastDispatcher dispatcher;
  private TaskScheduler scheduler;
  private RealtimeWebSocketHandler handler;

  @BeforeEach
  void setUp() {
    sessionStore = mock(SessionStore.class);
    registry = new ConnectionRegistry();
    dispatcher = new BroadcastDispatcher(registry, new ObjectMapper());
    scheduler = mock(TaskScheduler.class);
    handler = handlerWith(scheduler, Duration.ofSeconds(10));
  }

  @Test
  void missingSessionIdClosesWithPolicyViolation() throws Exception {
    var session = new FakeSession("c1", null);

    handler.afterConnectionEstablished(session.mock);

    verify(session.mock).close(RealtimeWebSocketHandler.NO_SESSION_ID);
    assertThat(RealtimeWebSocketHandler.NO_SESSION_ID.getCode()).isEqualTo(1008);
    assertThat(registry.size()).isZero();
    verifyNoInteractions(scheduler, sessionStore);
  }

  @Test
  void malformedSessionIdIsRejectedBeforeStoreLookup() throws Exception {
    var session = new FakeSession("c1", "not-a-session-token");

    handler.afterConnectionEstablished(session.mock);

    verify(session.mock).close(RealtimeWebSocketHandler.MALFORMED_SESSION_ID);
    verifyNoInteractions(sessionStore);
  }

  @Test
  void wellFormedSessionIdSchedulesAuthenticationAndTimeout() {
    var session = new FakeSession("c1", SessionTokens.generate());

    handler.afterConnectionEstablished(session.mock);

    verify(scheduler, times(2)).schedule(any(Runnable.class), any(Instant.class));
    assertThat(registry.isRegistered("c1")).isFalse();
  }

  @Test
  void resolvedPrincipalRegistersConnectionAndConfirms() throws Exception {
    var sid = SessionTokens.generate();
    when(sessionStore.resolve(sid)).thenReturn(Optional.of(ALICE));
    var session = new FakeSession("c1", sid);

    handler.authenticate(session.mock, decorate(session.mock), sid);

    assertThat(registry.find("c1")).hasValueSatisfying(c -> assertThat(c.userId()).isEqualTo(7L));
    var frame = ArgumentCaptor.forClass(TextMessage.class);
    verify(session.mock).sendMessage(frame.capture());
    assertThat(frame.getValue().getPayload())
        .contains("\"type\":\"connection_status\"")
        .contains("\"status\":\"connected\"")
        .contains("\"userId\":7");
  }

  @Test
  void unknownSessionClosesUnauthorizedWithoutRegistering() throws Exception {
    var sid = SessionTokens.generate();
    when(sessionStore.resolve(sid)).thenReturn(Optional.empty());
    var session = new FakeSession("c1", sid);

    handler.authenticate(session.mock, decorate(session.mock), sid);

    verify(session.mock).close(RealtimeWebSocketHandler.UNAUTHORIZED);
    assertThat(registry.size()).isZero();
  }

  @Test
  void storeFailureClosesWithServerError() throws Exception {
    var sid = SessionTokens.generate();
    when(sessionStore.resolve(sid)).thenThrow(new DataAccessResourceFailureException("db down"));
    var session = new FakeSession("c1", sid);

    handler.authenticate(session.mock, decorate(session.mock), sid);

    verify(session.mock).close(RealtimeWebSocketHandler.STORE_FAILURE);
    assertThat(RealtimeWebSocketHandler.STORE_FAILURE.getCode()).isEqualTo(1011);
    assertThat(registry.size()).isZero();
  }

  @Test
  void authTimeoutClosesOnlyUnregisteredConnections() throws Exception {
    var pending = new FakeSession("pending", SessionTokens.generate());
    var registered = new FakeSession("registered", SessionTokens.generate());
    registry.register("registered", registered.mock, ALICE);

    handler.expireUnauthenticated(pending.mock);
    handler.expireUnauthenticated(registered.mock);

    verify(pending.mock).close(RealtimeWebSocketHandler.AUTH_TIMEOUT);
    verify(registered.mock, never()).close(any(CloseStatus.class));
  }

  @Test
  void slowLookupIsClosedAtTimeoutAndNeverRegistered() throws Exception {
    var realScheduler = new ThreadPoolTaskScheduler();
    realScheduler.setPoolSize(2);
    realScheduler.setWaitForTasksToCompleteOnShutdown(true);
    realScheduler.setAwaitTerminationSeconds(5);
    realScheduler.initialize();
    var slowHandler = handlerWith(realScheduler, Duration.ofMillis(100));

    var release = new CountDownLatch(1);
    when(sessionStore.resolve(anyString()))
        .thenAnswer(
            invocation -> {
              release.await(5, TimeUnit.SECONDS);
              return Optional.of(ALICE);
            });
    var session = new FakeSession("slow", SessionTokens.generate());

    try {
      slowHandler.afterConnectionEstablished(session.mock);
      verify(session.mock, timeout(2000)).close(RealtimeWebSocketHandler.AUTH_TIMEOUT);
    } finally {
      release.countDown();
      realScheduler.shutdown();
    }

    assertThat(registry.isRegistered("slow")).isFalse();
  }

  @Test
  void pingFrameFromRegisteredConnectionIsAnsweredWithPong() throws Exception {
    var session = new FakeSession("c1", SessionTokens.generate());
    registry.register("c1", session.mock, ALICE);

    handler.handleTextMessage(session.mock, new TextMessage("{\"type\":\"ping\"}"));

    var frame = ArgumentCaptor.forClass(TextMessage.class);
    verify(session.mock).sendMessage(frame.capture());
    assertThat(frame.getValue().getPayload()).isEqualTo("{\"type\":\"pong\"}");
  }

  @Test
  void unreadableFrameGetsErrorReply() throws Exception {
    var session = new FakeSession("c1", SessionTokens.generate());
    registry.register("c1", session.mock, ALICE);

    handler.handleTextMessage(session.mock, new TextMessage("{not json"));

    var frame = ArgumentCaptor.forClass(TextMessage.class);
    verify(session.mock).sendMessage(frame.capture());
    assertThat(frame.getValue().getPayload()).contains("Failed to process message");
  }

  @Test
  void framesFromUnauthenticatedConnectionsAreIgnored() throws Exception {
    var session = new FakeSession("c1", SessionTokens.generate());

    handler.handleTextMessage(session.mock, new TextMessage("{\"type\":\"ping\"}"));

    verify(session.mock, never()).sendMessage(any());
  }

  @Test
  void closeAndTransportErrorBothRemoveTheEntry() {
    var closed = new FakeSession("c1", SessionTokens.generate());
    var errored = new FakeSession("c2", SessionTokens.generate());
    registry.register("c1", closed.mock, ALICE);
    registry.register("c2", errored.mock, ALICE);

    handler.afterConnectionClosed(closed.mock, CloseStatus.NORMAL);
    handler.handleTransportError(errored.mock, new EOFException("reset"));

    assertThat(registry.size()).isZero();
  }

  private RealtimeWebSocketHandler handlerWith(TaskScheduler taskScheduler, Duration authTimeout) {
    var properties =
        new RealtimeProperties(
            "/ws",
            authTimeout,
            30_000,
            Duration.ofSeconds(10),
            DataSize.ofKilobytes(512),
            List.of("*"));
    return new RealtimeWebSocketHandler(
        sessionStore, registry, dispatcher, taskScheduler, new ObjectMapper(), properties);
  }

  private static WebSocketSession decorate(WebSocketSession session) {
    return new ConcurrentWebSocketSessionDecorator(session, 10_000, 512 * 1024);
  }

  /** Mocked transport whose open flag flips when it is closed. */
  private static final class FakeSession {

    final WebSocketSession mock = mock(WebSocketSession.class);
    final AtomicBoolean open = new AtomicBoolean(true);

    FakeSession(String id, String sid) {
      var attributes = new HashMap<String, Object>();
      if (sid != null) {
        attributes.put(SessionCookieHandshakeInterceptor.SESSION_ID_ATTRIBUTE, sid);
      }
      when(mock.getId()).thenReturn(id);
      when(mock.getAttributes()).thenReturn(attributes);
      when(mock.isOpen()).thenAnswer(invocation -> open.get());
      try {
        doAnswer(
                invocation -> {
                  open.set(false);
                  return null;
                })
            .when(mock)
            .close(any(CloseStatus.class));
      } catch (IOException e) {
        throw new IllegalStateException(e);
      }
    }
  }
}

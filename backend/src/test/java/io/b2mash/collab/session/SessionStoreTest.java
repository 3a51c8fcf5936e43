package io.b2mash.collab.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.collab.persistence.PersistenceExecutor;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class SessionStoreTest {

  private static final Instant NOW = Instant.parse("2026-01-05T10:00:00Z");

  @Mock private UserSessionRepository repository;
  @Mock private PersistenceExecutor executor;

  private SessionStore store;

  @BeforeEach
  void setUp() {
    var properties = new SessionProperties("collab.sid", Duration.ofDays(7), false);
    store = new SessionStore(repository, executor, properties, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void liveSessionResolvesToStoredPrincipal() {
    var sid = SessionTokens.generate();
    var session =
        new UserSession(sid, new SessionPrincipal(7L, "alice"), NOW, NOW.plus(Duration.ofDays(1)));
    readsInline();
    when(repository.findById(sid)).thenReturn(Optional.of(session));

    assertThat(store.resolve(sid)).contains(new SessionPrincipal(7L, "alice"));
  }

  @Test
  void expiredSessionResolvesToEmpty() {
    var sid = SessionTokens.generate();
    var session =
        new UserSession(
            sid, new SessionPrincipal(7L, "alice"), NOW.minusSeconds(60), NOW.minusSeconds(1));
    readsInline();
    when(repository.findById(sid)).thenReturn(Optional.of(session));

    assertThat(store.resolve(sid)).isEmpty();
  }

  @Test
  void malformedIdNeverReachesTheStore() {
    assertThat(store.resolve("s:legacy.cookie")).isEmpty();
    verifyNoInteractions(executor, repository);
  }

  @Test
  void storeFailurePropagates() {
    var sid = SessionTokens.generate();
    when(executor.executeReadOnly(any(), anyString()))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    assertThatThrownBy(() -> store.resolve(sid))
        .isInstanceOf(DataAccessResourceFailureException.class);
  }

  @Test
  void invalidateIgnoresMalformedIds() {
    store.invalidate("bogus");

    verify(executor, never()).runTransactionWithRetry(any(), anyString());
  }

  @SuppressWarnings("unchecked")
  private void readsInline() {
    when(executor.executeReadOnly(any(), anyString()))
        .thenAnswer(invocation -> ((Supplier<Object>) invocation.getArgument(0)).get());
  }
}

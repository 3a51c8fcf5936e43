package io.b2mash.collab.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionSynchronizationManager;

class PersistenceExecutorTest {

  private PlatformTransactionManager transactionManager;
  private ListAppender<ILoggingEvent> appender;
  private Logger executorLogger;

  @BeforeEach
  void setUp() {
    transactionManager = mock(PlatformTransactionManager.class);
    when(transactionManager.getTransaction(any())).thenReturn(mock(TransactionStatus.class));

    executorLogger = (Logger) LoggerFactory.getLogger(PersistenceExecutor.class);
    appender = new ListAppender<>();
    appender.start();
    executorLogger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    executorLogger.detachAppender(appender);
  }

  @Test
  void transientFailureThenSuccessWritesOnceAfterBackoff() {
    var executor = executorWithBaseDelay(Duration.ofMillis(300));
    var calls = new AtomicInteger();
    var writes = new AtomicInteger();

    long started = System.nanoTime();
    var result =
        executor.executeWithRetry(
            () -> {
              if (calls.incrementAndGet() == 1) {
                throw connectionLost();
              }
              writes.incrementAndGet();
              return "written";
            },
            "writeRow");
    long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

    assertThat(result).isEqualTo("written");
    assertThat(calls).hasValue(2);
    assertThat(writes).hasValue(1);
    assertThat(elapsedMillis).isGreaterThanOrEqualTo(300);
    assertThat(messagesAt(Level.WARN)).containsExactly("Attempt 1/3 of writeRow failed");
    assertThat(messagesAt(Level.INFO)).containsExactly("Retrying writeRow (attempt 2/3)");
  }

  @Test
  void permanentFailureIsNotRetried() {
    var executor = executorWithBaseDelay(Duration.ofMillis(10));
    var calls = new AtomicInteger();

    assertThatThrownBy(
            () ->
                executor.executeWithRetry(
                    () -> {
                      calls.incrementAndGet();
                      throw new DataIntegrityViolationException("duplicate key");
                    },
                    "insertDuplicate"))
        .isInstanceOf(DataIntegrityViolationException.class);

    assertThat(calls).hasValue(1);
    assertThat(messagesAt(Level.WARN)).isEmpty();
  }

  @Test
  void exhaustedRetriesRethrowLastFailure() {
    var executor = executorWithBaseDelay(Duration.ofMillis(10));
    var calls = new AtomicInteger();

    assertThatThrownBy(
            () ->
                executor.executeWithRetry(
                    () -> {
                      calls.incrementAndGet();
                      throw connectionLost();
                    },
                    "alwaysDown"))
        .isInstanceOf(DataAccessResourceFailureException.class);

    assertThat(calls).hasValue(3);
    assertThat(messagesAt(Level.ERROR)).containsExactly("alwaysDown failed after 3 attempt(s)");
  }

  @Test
  void operationRunsOnceInsideActiveTransaction() {
    var executor = executorWithBaseDelay(Duration.ofMillis(10));
    var calls = new AtomicInteger();

    TransactionSynchronizationManager.setActualTransactionActive(true);
    try {
      assertThatThrownBy(
              () ->
                  executor.executeWithRetry(
                      () -> {
                        calls.incrementAndGet();
                        throw connectionLost();
                      },
                      "nestedWrite"))
          .isInstanceOf(DataAccessResourceFailureException.class);
    } finally {
      TransactionSynchronizationManager.setActualTransactionActive(false);
    }

    assertThat(calls).hasValue(1);
  }

  @Test
  void transactionCommitsOnSuccess() {
    var executor = executorWithBaseDelay(Duration.ofMillis(10));

    var result = executor.executeTransaction(() -> 42);

    assertThat(result).isEqualTo(42);
    verify(transactionManager).commit(any());
    verify(transactionManager, never()).rollback(any());
  }

  @Test
  void transactionRollsBackAndRethrowsOnFailure() {
    var executor = executorWithBaseDelay(Duration.ofMillis(10));

    assertThatThrownBy(
            () ->
                executor.executeTransaction(
                    () -> {
                      throw new IllegalStateException("second write failed");
                    }))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("second write failed");

    verify(transactionManager).rollback(any());
    verify(transactionManager, never()).commit(any());
  }

  private PersistenceExecutor executorWithBaseDelay(Duration baseDelay) {
    return new PersistenceExecutor(transactionManager, new RetryProperties(3, baseDelay, 2.0));
  }

  private static DataAccessResourceFailureException connectionLost() {
    return new DataAccessResourceFailureException(
        "connection lost", new SQLException("I/O error", "08006"));
  }

  private List<String> messagesAt(Level level) {
    return appender.list.stream()
        .filter(event -> event.getLevel() == level)
        .map(ILoggingEvent::getFormattedMessage)
        .map(message -> message.replaceFirst(": transient=true.*$", ""))
        .toList();
  }
}

package io.b2mash.collab.persistence;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs persistence work with bounded retry on transient connection failures and explicit
 * transaction boundaries.
 *
 * <p>Retry wraps the whole unit of work: a retried transaction starts over on a fresh connection.
 * When a transaction is already bound to the calling thread, {@link #executeWithRetry} runs the
 * operation once on that transaction's connection and leaves failure handling to the outer unit.
 */
@Component
public class PersistenceExecutor {

  private static final Logger log = LoggerFactory.getLogger(PersistenceExecutor.class);

  private static final long MAX_BACKOFF_MILLIS = 10_000;

  private final RetryTemplate retryTemplate;
  private final TransactionTemplate transactionTemplate;
  private final TransactionTemplate readOnlyTemplate;
  private final int maxAttempts;

  public PersistenceExecutor(
      PlatformTransactionManager transactionManager, RetryProperties retryProperties) {
    this.maxAttempts = retryProperties.maxAttempts();
    this.retryTemplate = buildRetryTemplate(retryProperties);
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.readOnlyTemplate = new TransactionTemplate(transactionManager);
    this.readOnlyTemplate.setReadOnly(true);
  }

  /**
   * Runs {@code operation}, retrying transient failures with exponential backoff. Permanent
   * failures propagate on the first attempt; on exhaustion the last failure is rethrown.
   */
  public <T> T executeWithRetry(Supplier<T> operation, String operationName) {
    if (TransactionSynchronizationManager.isActualTransactionActive()) {
      return operation.get();
    }

    var attempts = new AtomicInteger();
    try {
      return retryTemplate.execute(
          context -> {
            int attempt = attempts.incrementAndGet();
            if (attempt > 1) {
              log.info("Retrying {} (attempt {}/{})", operationName, attempt, maxAttempts);
            }
            try {
              return operation.get();
            } catch (RuntimeException e) {
              if (TransientFailures.isTransient(e)) {
                log.warn(
                    "Attempt {}/{} of {} failed: transient=true, error={}",
                    attempt,
                    maxAttempts,
                    operationName,
                    e.getMessage());
              } else {
                log.debug(
                    "Attempt {}/{} of {} failed: transient=false, error={}",
                    attempt,
                    maxAttempts,
                    operationName,
                    e.getMessage());
              }
              throw e;
            }
          });
    } catch (RuntimeException e) {
      if (TransientFailures.isTransient(e)) {
        log.error("{} failed after {} attempt(s)", operationName, attempts.get(), e);
      } else {
        log.debug("{} failed with a non-retryable error: {}", operationName, e.getMessage());
      }
      throw e;
    }
  }

  public void runWithRetry(Runnable operation, String operationName) {
    executeWithRetry(
        () -> {
          operation.run();
          return null;
        },
        operationName);
  }

  /**
   * Runs {@code operations} inside a single transaction on one pooled connection. Commits on
   * success; rolls back and rethrows on any failure.
   */
  public <T> T executeTransaction(Supplier<T> operations) {
    try {
      return transactionTemplate.execute(status -> operations.get());
    } catch (RuntimeException e) {
      log.debug("Transaction rolled back: {}", e.getMessage());
      throw e;
    }
  }

  /** A transaction retried as a whole on transient failure. */
  public <T> T executeTransactionWithRetry(Supplier<T> operations, String operationName) {
    return executeWithRetry(() -> executeTransaction(operations), operationName);
  }

  public void runTransactionWithRetry(Runnable operations, String operationName) {
    executeTransactionWithRetry(
        () -> {
          operations.run();
          return null;
        },
        operationName);
  }

  /** Read-only transaction, retried on transient failure. */
  public <T> T executeReadOnly(Supplier<T> query, String operationName) {
    return executeWithRetry(() -> readOnlyTemplate.execute(status -> query.get()), operationName);
  }

  private static RetryTemplate buildRetryTemplate(RetryProperties properties) {
    var backOff = new ExponentialBackOffPolicy();
    backOff.setInitialInterval(properties.baseDelay().toMillis());
    backOff.setMultiplier(properties.multiplier());
    backOff.setMaxInterval(MAX_BACKOFF_MILLIS);

    var template = new RetryTemplate();
    template.setRetryPolicy(new TransientFailureRetryPolicy(properties.maxAttempts()));
    template.setBackOffPolicy(backOff);
    template.setThrowLastExceptionOnExhausted(true);
    return template;
  }
}

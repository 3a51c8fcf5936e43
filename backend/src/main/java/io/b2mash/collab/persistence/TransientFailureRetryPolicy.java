package io.b2mash.collab.persistence;

import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;

/** Retries up to a fixed number of attempts, but only while the last failure is transient. */
class TransientFailureRetryPolicy extends SimpleRetryPolicy {

  TransientFailureRetryPolicy(int maxAttempts) {
    super(maxAttempts);
  }

  @Override
  public boolean canRetry(RetryContext context) {
    Throwable lastFailure = context.getLastThrowable();
    if (lastFailure != null && !TransientFailures.isTransient(lastFailure)) {
      return false;
    }
    return context.getRetryCount() < getMaxAttempts();
  }
}

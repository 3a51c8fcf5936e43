package io.b2mash.collab.notification;

import java.util.List;

/**
 * Result of a committed mutation together with the side effects (participant rows, broadcasts,
 * fanout) that did not complete. The mutation itself is durable either way.
 */
public record MutationOutcome<T>(T result, List<String> failedSideEffects) {

  public MutationOutcome {
    failedSideEffects = List.copyOf(failedSideEffects);
  }

  public static <T> MutationOutcome<T> of(T result) {
    return new MutationOutcome<>(result, List.of());
  }

  public boolean hasFailures() {
    return !failedSideEffects.isEmpty();
  }
}

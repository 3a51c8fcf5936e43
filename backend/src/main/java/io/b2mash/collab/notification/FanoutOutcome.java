package io.b2mash.collab.notification;

import io.b2mash.collab.realtime.DeliveryReport;
import java.util.List;

/**
 * Result of one fanout. {@code failedRecipients} lists users whose record could not be persisted;
 * {@code skipped} counts recipients without a contact address or unknown to the user store.
 */
public record FanoutOutcome(
    int audience,
    int persisted,
    int skipped,
    List<Long> failedRecipients,
    DeliveryReport delivery) {

  public static final FanoutOutcome NONE =
      new FanoutOutcome(0, 0, 0, List.of(), DeliveryReport.EMPTY);

  public boolean hasFailures() {
    return !failedRecipients.isEmpty() || delivery.failed() > 0;
  }
}

package io.b2mash.collab.notification;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Map;
import java.util.Set;

/** Notification delivery state. Records only move forward: pending, then sent and/or read. */
public enum NotificationStatus {
  PENDING,
  SENT,
  READ;

  private static final Map<NotificationStatus, Set<NotificationStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          PENDING, Set.of(SENT, READ),
          SENT, Set.of(READ),
          READ, Set.of());

  public Set<NotificationStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  public boolean canTransitionTo(NotificationStatus target) {
    return allowedTransitions().contains(target);
  }

  @JsonValue
  public String wireValue() {
    return name().toLowerCase();
  }
}

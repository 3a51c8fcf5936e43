package io.b2mash.collab.notification;

import java.time.Instant;

public record NotificationResponse(
    Long id,
    String type,
    String subject,
    String content,
    NotificationStatus status,
    String relatedEntityType,
    Long relatedEntityId,
    Instant createdAt,
    Instant readAt) {

  public static NotificationResponse from(Notification notification) {
    return new NotificationResponse(
        notification.getId(),
        notification.getType(),
        notification.getSubject(),
        notification.getContent(),
        notification.getStatus(),
        notification.getRelatedEntityType(),
        notification.getRelatedEntityId(),
        notification.getCreatedAt(),
        notification.getReadAt());
  }
}

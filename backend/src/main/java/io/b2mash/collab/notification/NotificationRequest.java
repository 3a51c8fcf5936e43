package io.b2mash.collab.notification;

/** What to record for each recipient of a fanout. */
public record NotificationRequest(
    NotificationType type,
    String subject,
    String content,
    String relatedEntityType,
    Long relatedEntityId) {

  public static NotificationRequest forTask(
      NotificationType type, String subject, String content, Long taskId) {
    return new NotificationRequest(type, subject, content, "task", taskId);
  }
}

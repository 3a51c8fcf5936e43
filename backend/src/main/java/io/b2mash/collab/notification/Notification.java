package io.b2mash.collab.notification;

import io.b2mash.collab.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "notifications")
public class Notification {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "user_id", nullable = false)
  private Long userId;

  @Column(name = "type", nullable = false, length = 50)
  private String type;

  @Column(name = "subject", nullable = false, length = 500)
  private String subject;

  @Column(name = "content", length = 4000)
  private String content;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private NotificationStatus status;

  @Column(name = "recipient_email", length = 320)
  private String recipientEmail;

  @Column(name = "related_entity_type", length = 50)
  private String relatedEntityType;

  @Column(name = "related_entity_id")
  private Long relatedEntityId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "sent_at")
  private Instant sentAt;

  @Column(name = "read_at")
  private Instant readAt;

  protected Notification() {}

  public Notification(
      Long userId,
      NotificationType type,
      String subject,
      String content,
      String recipientEmail,
      String relatedEntityType,
      Long relatedEntityId) {
    this.userId = userId;
    this.type = type.value();
    this.subject = subject;
    this.content = content;
    this.recipientEmail = recipientEmail;
    this.relatedEntityType = relatedEntityType;
    this.relatedEntityId = relatedEntityId;
    this.status = NotificationStatus.PENDING;
    this.createdAt = Instant.now();
  }

  public void markSent(Instant at) {
    transitionTo(NotificationStatus.SENT);
    this.sentAt = at;
  }

  public void markRead(Instant at) {
    transitionTo(NotificationStatus.READ);
    this.readAt = at;
  }

  public boolean isRead() {
    return status == NotificationStatus.READ;
  }

  private void transitionTo(NotificationStatus target) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid notification transition",
          "Notification " + id + " cannot move from " + status + " to " + target);
    }
    this.status = target;
  }

  public Long getId() {
    return id;
  }

  public Long getUserId() {
    return userId;
  }

  public String getType() {
    return type;
  }

  public String getSubject() {
    return subject;
  }

  public String getContent() {
    return content;
  }

  public NotificationStatus getStatus() {
    return status;
  }

  public String getRecipientEmail() {
    return recipientEmail;
  }

  public String getRelatedEntityType() {
    return relatedEntityType;
  }

  public Long getRelatedEntityId() {
    return relatedEntityId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getSentAt() {
    return sentAt;
  }

  public Instant getReadAt() {
    return readAt;
  }
}

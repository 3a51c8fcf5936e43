package io.b2mash.collab.message;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "private_messages")
public class PrivateMessage {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "sender_id", nullable = false)
  private Long senderId;

  @Column(name = "recipient_id", nullable = false)
  private Long recipientId;

  @Column(name = "content", nullable = false, length = 10000)
  private String content;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "read_at")
  private Instant readAt;

  protected PrivateMessage() {}

  public PrivateMessage(Long senderId, Long recipientId, String content) {
    this.senderId = senderId;
    this.recipientId = recipientId;
    this.content = content;
    this.createdAt = Instant.now();
  }

  /** The other party of the conversation, as seen by {@code userId}. */
  public Long partnerOf(Long userId) {
    return senderId.equals(userId) ? recipientId : senderId;
  }

  public boolean isUnreadFor(Long userId) {
    return recipientId.equals(userId) && readAt == null;
  }

  public Long getId() {
    return id;
  }

  public Long getSenderId() {
    return senderId;
  }

  public Long getRecipientId() {
    return recipientId;
  }

  public String getContent() {
    return content;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getReadAt() {
    return readAt;
  }
}

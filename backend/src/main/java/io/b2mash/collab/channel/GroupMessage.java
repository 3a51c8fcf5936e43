package io.b2mash.collab.channel;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "group_messages")
public class GroupMessage {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "channel_id", nullable = false)
  private Long channelId;

  @Column(name = "sender_id", nullable = false)
  private Long senderId;

  @Column(name = "content", nullable = false, length = 10000)
  private String content;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected GroupMessage() {}

  public GroupMessage(Long channelId, Long senderId, String content) {
    this.channelId = channelId;
    this.senderId = senderId;
    this.content = content;
    this.createdAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public Long getChannelId() {
    return channelId;
  }

  public Long getSenderId() {
    return senderId;
  }

  public String getContent() {
    return content;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}

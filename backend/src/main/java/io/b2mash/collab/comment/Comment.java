package io.b2mash.collab.comment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "comments")
public class Comment {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "task_id", nullable = false)
  private Long taskId;

  @Column(name = "user_id", nullable = false)
  private Long userId;

  @Column(name = "content", nullable = false, length = 10000)
  private String content;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Comment() {}

  public Comment(Long taskId, Long userId, String content) {
    this.taskId = taskId;
    this.userId = userId;
    this.content = content;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  public void updateContent(String content) {
    this.content = content;
    this.updatedAt = Instant.now();
  }

  public boolean isAuthoredBy(Long userId) {
    return this.userId.equals(userId);
  }

  public Long getId() {
    return id;
  }

  public Long getTaskId() {
    return taskId;
  }

  public Long getUserId() {
    return userId;
  }

  public String getContent() {
    return content;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}

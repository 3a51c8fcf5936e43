package io.b2mash.collab.task;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/** Append-only audit row. Never updated once written; removed only with its task. */
@Entity
@Table(name = "task_history")
public class TaskHistoryEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "task_id", nullable = false, updatable = false)
  private Long taskId;

  @Column(name = "user_id", nullable = false, updatable = false)
  private Long userId;

  @Column(name = "action", nullable = false, updatable = false, length = 50)
  private String action;

  @Column(name = "old_value", updatable = false, length = 4000)
  private String oldValue;

  @Column(name = "new_value", updatable = false, length = 4000)
  private String newValue;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected TaskHistoryEntry() {}

  public TaskHistoryEntry(
      Long taskId, Long userId, TaskHistoryAction action, String oldValue, String newValue) {
    this.taskId = taskId;
    this.userId = userId;
    this.action = action.value();
    this.oldValue = oldValue;
    this.newValue = newValue;
    this.createdAt = Instant.now();
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

  public String getAction() {
    return action;
  }

  public String getOldValue() {
    return oldValue;
  }

  public String getNewValue() {
    return newValue;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}

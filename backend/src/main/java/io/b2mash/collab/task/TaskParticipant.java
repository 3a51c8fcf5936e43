package io.b2mash.collab.task;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

@Entity
@Table(name = "task_participants")
@IdClass(TaskParticipantId.class)
public class TaskParticipant {

  @Id
  @Column(name = "task_id", nullable = false)
  private Long taskId;

  @Id
  @Column(name = "user_id", nullable = false)
  private Long userId;

  protected TaskParticipant() {}

  public TaskParticipant(Long taskId, Long userId) {
    this.taskId = taskId;
    this.userId = userId;
  }

  public Long getTaskId() {
    return taskId;
  }

  public Long getUserId() {
    return userId;
  }
}

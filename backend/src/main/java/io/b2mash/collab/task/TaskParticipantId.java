package io.b2mash.collab.task;

import java.io.Serializable;
import java.util.Objects;

public class TaskParticipantId implements Serializable {

  private Long taskId;
  private Long userId;

  protected TaskParticipantId() {}

  public TaskParticipantId(Long taskId, Long userId) {
    this.taskId = taskId;
    this.userId = userId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TaskParticipantId other)) {
      return false;
    }
    return Objects.equals(taskId, other.taskId) && Objects.equals(userId, other.userId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(taskId, userId);
  }
}

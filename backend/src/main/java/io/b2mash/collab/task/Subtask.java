package io.b2mash.collab.task;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "subtasks")
public class Subtask {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "task_id", nullable = false)
  private Long taskId;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "completed", nullable = false)
  private boolean completed;

  protected Subtask() {}

  public Subtask(Long taskId, String title, boolean completed) {
    this.taskId = taskId;
    this.title = title;
    this.completed = completed;
  }

  public void setCompleted(boolean completed) {
    this.completed = completed;
  }

  public Long getId() {
    return id;
  }

  public Long getTaskId() {
    return taskId;
  }

  public String getTitle() {
    return title;
  }

  public boolean isCompleted() {
    return completed;
  }
}

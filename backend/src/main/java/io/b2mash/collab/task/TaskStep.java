package io.b2mash.collab.task;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "task_steps")
public class TaskStep {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "task_id", nullable = false)
  private Long taskId;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "description", length = 4000)
  private String description;

  @Column(name = "step_order", nullable = false)
  private int stepOrder;

  @Column(name = "completed", nullable = false)
  private boolean completed;

  protected TaskStep() {}

  public TaskStep(Long taskId, String title, String description, int stepOrder, boolean completed) {
    this.taskId = taskId;
    this.title = title;
    this.description = description;
    this.stepOrder = stepOrder;
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

  public String getDescription() {
    return description;
  }

  public int getStepOrder() {
    return stepOrder;
  }

  public boolean isCompleted() {
    return completed;
  }
}

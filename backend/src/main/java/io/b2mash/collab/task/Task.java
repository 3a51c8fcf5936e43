package io.b2mash.collab.task;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "tasks")
public class Task {

  /** Status of a freshly created task. Any other status string is accepted afterwards. */
  public static final String DEFAULT_STATUS = "todo";

  public static final String DEFAULT_PRIORITY = "medium";

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "description", length = 10000)
  private String description;

  @Column(name = "status", nullable = false, length = 50)
  private String status;

  @Column(name = "priority", nullable = false, length = 20)
  private String priority;

  @Column(name = "creator_id", nullable = false, updatable = false)
  private Long creatorId;

  @Column(name = "responsible_id")
  private Long responsibleId;

  @Column(name = "workflow_id")
  private Long workflowId;

  @Column(name = "stage_id")
  private Long stageId;

  @Column(name = "due_date")
  private LocalDate dueDate;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Task() {}

  public Task(
      String title,
      String description,
      String priority,
      Long creatorId,
      Long responsibleId,
      Long workflowId,
      Long stageId,
      LocalDate dueDate) {
    this.title = title;
    this.description = description;
    this.status = DEFAULT_STATUS;
    this.priority = priority != null ? priority : DEFAULT_PRIORITY;
    this.creatorId = creatorId;
    this.responsibleId = responsibleId;
    this.workflowId = workflowId;
    this.stageId = stageId;
    this.dueDate = dueDate;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  public void changeStatus(String status) {
    this.status = status;
    touch();
  }

  public void rename(String title) {
    this.title = title;
    touch();
  }

  public void describe(String description) {
    this.description = description;
    touch();
  }

  public void prioritize(String priority) {
    this.priority = priority;
    touch();
  }

  public void assignResponsible(Long responsibleId) {
    this.responsibleId = responsibleId;
    touch();
  }

  public void reschedule(LocalDate dueDate) {
    this.dueDate = dueDate;
    touch();
  }

  public void moveToStage(Long workflowId, Long stageId) {
    this.workflowId = workflowId;
    this.stageId = stageId;
    touch();
  }

  /** Called when child rows change so listings sort the task as recently updated. */
  public void touch() {
    this.updatedAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public String getStatus() {
    return status;
  }

  public String getPriority() {
    return priority;
  }

  public Long getCreatorId() {
    return creatorId;
  }

  public Long getResponsibleId() {
    return responsibleId;
  }

  public Long getWorkflowId() {
    return workflowId;
  }

  public Long getStageId() {
    return stageId;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}

package io.b2mash.collab.workflow;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "workflow_stages")
public class WorkflowStage {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "workflow_id", nullable = false)
  private Long workflowId;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "description", length = 2000)
  private String description;

  @Column(name = "stage_order", nullable = false)
  private int stageOrder;

  @Column(name = "color", length = 20)
  private String color;

  protected WorkflowStage() {}

  public WorkflowStage(
      Long workflowId, String name, String description, int stageOrder, String color) {
    this.workflowId = workflowId;
    this.name = name;
    this.description = description;
    this.stageOrder = stageOrder;
    this.color = color;
  }

  public Long getId() {
    return id;
  }

  public Long getWorkflowId() {
    return workflowId;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public int getStageOrder() {
    return stageOrder;
  }

  public String getColor() {
    return color;
  }
}

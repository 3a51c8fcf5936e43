package io.b2mash.collab.task;

public enum TaskHistoryAction {
  CREATED("created"),
  STATUS_CHANGED("status_changed"),
  UPDATED("updated"),
  DUE_DATE_CHANGED("due_date_changed"),
  STAGE_CHANGED("stage_changed"),
  SUBTASK_STATUS_CHANGED("subtask_status_changed"),
  STEP_STATUS_CHANGED("step_status_changed");

  private final String value;

  TaskHistoryAction(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}

package io.b2mash.collab.notification;

public enum NotificationType {
  TASK_ASSIGNMENT("task_assignment"),
  TASK_UPDATED("task_updated"),
  TASK_DUE_DATE("task_due_date"),
  TASK_COMMENT("task_comment"),
  PRIVATE_MESSAGE("private_message"),
  GROUP_MESSAGE("group_message");

  private final String value;

  NotificationType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}

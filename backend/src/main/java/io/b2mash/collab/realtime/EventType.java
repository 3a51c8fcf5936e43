package io.b2mash.collab.realtime;

import com.fasterxml.jackson.annotation.JsonValue;

/** Catalog of realtime event types, with the names clients see on the wire. */
public enum EventType {
  CONNECTION_STATUS("connection_status"),
  PONG("pong"),
  ERROR("error"),
  TASK_CREATED("task_created"),
  TASK_UPDATED("task_updated"),
  TASK_STATUS_CHANGED("task_status_changed"),
  TASK_DUE_DATE_UPDATED("task_due_date_updated"),
  TASK_STAGE_CHANGED("task_stage_changed"),
  TASK_DELETED("task_deleted"),
  COMMENT_CREATED("COMMENT_CREATED"),
  COMMENT_UPDATED("COMMENT_UPDATED"),
  COMMENT_DELETED("COMMENT_DELETED"),
  PRIVATE_MESSAGE("private_message"),
  NEW_GROUP_MESSAGE("NEW_GROUP_MESSAGE"),
  CHANNEL_MEMBER_ADDED("CHANNEL_MEMBER_ADDED"),
  CHANNEL_MEMBER_REMOVED("CHANNEL_MEMBER_REMOVED"),
  NOTIFICATION_CREATED("notification_created");

  private final String wireName;

  EventType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}

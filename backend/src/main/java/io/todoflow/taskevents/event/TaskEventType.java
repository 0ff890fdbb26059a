package io.todoflow.taskevents.event;

import java.util.Arrays;
import java.util.Optional;

/** CloudEvents {@code type} attribute values for task change events. */
public enum TaskEventType {
  CREATED("task.created", "created"),
  UPDATED("task.updated", "updated"),
  DELETED("task.deleted", "deleted"),
  COMPLETED("task.completed", "completed");

  private final String cloudEventType;
  private final String change;

  TaskEventType(String cloudEventType, String change) {
    this.cloudEventType = cloudEventType;
    this.change = change;
  }

  public String cloudEventType() {
    return cloudEventType;
  }

  /** Short change name used in client-facing update messages. */
  public String change() {
    return change;
  }

  public static Optional<TaskEventType> fromCloudEventType(String value) {
    return Arrays.stream(values()).filter(t -> t.cloudEventType.equals(value)).findFirst();
  }
}

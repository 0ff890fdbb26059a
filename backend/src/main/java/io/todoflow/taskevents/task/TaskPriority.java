package io.todoflow.taskevents.task;

public enum TaskPriority {
  LOW,
  MEDIUM,
  HIGH
}

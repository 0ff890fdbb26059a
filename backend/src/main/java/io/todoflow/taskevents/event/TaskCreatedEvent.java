package io.todoflow.taskevents.event;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

public record TaskCreatedEvent(
    UUID eventId, String correlationId, Instant occurredAt, TaskSnapshot task)
    implements TaskChangeEvent {

  public TaskCreatedEvent {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(correlationId, "correlationId");
    Objects.requireNonNull(occurredAt, "occurredAt");
    Objects.requireNonNull(task, "task");
  }

  public static TaskCreatedEvent of(TaskSnapshot task, String correlationId, Instant occurredAt) {
    return new TaskCreatedEvent(UUID.randomUUID(), correlationId, occurredAt, task);
  }

  @Override
  public TaskEventType eventType() {
    return TaskEventType.CREATED;
  }

  @Override
  public UUID taskId() {
    return task.taskId();
  }

  @Override
  public String userId() {
    return task.userId();
  }

  @Override
  public Optional<TaskSnapshot> snapshot() {
    return Optional.of(task);
  }
}

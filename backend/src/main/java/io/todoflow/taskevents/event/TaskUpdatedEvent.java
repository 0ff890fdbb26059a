package io.todoflow.taskevents.event;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/** A task changed. {@code changedFields} names the task fields that differ from before. */
public record TaskUpdatedEvent(
    UUID eventId,
    String correlationId,
    Instant occurredAt,
    TaskSnapshot task,
    List<String> changedFields)
    implements TaskChangeEvent {

  public TaskUpdatedEvent {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(correlationId, "correlationId");
    Objects.requireNonNull(occurredAt, "occurredAt");
    Objects.requireNonNull(task, "task");
    changedFields = changedFields == null ? List.of() : List.copyOf(changedFields);
  }

  public static TaskUpdatedEvent of(
      TaskSnapshot task, List<String> changedFields, String correlationId, Instant occurredAt) {
    return new TaskUpdatedEvent(UUID.randomUUID(), correlationId, occurredAt, task, changedFields);
  }

  @Override
  public TaskEventType eventType() {
    return TaskEventType.UPDATED;
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

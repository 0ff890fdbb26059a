package io.todoflow.taskevents.event;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A task was completed. {@code recurrence} is present when the task belongs to a recurring
 * series and drives creation of the next instance.
 */
public record TaskCompletedEvent(
    UUID eventId,
    String correlationId,
    Instant occurredAt,
    TaskSnapshot task,
    RecurrenceSnapshot recurrence)
    implements TaskChangeEvent {

  public TaskCompletedEvent {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(correlationId, "correlationId");
    Objects.requireNonNull(occurredAt, "occurredAt");
    Objects.requireNonNull(task, "task");
  }

  public static TaskCompletedEvent of(
      TaskSnapshot task, RecurrenceSnapshot recurrence, String correlationId, Instant occurredAt) {
    return new TaskCompletedEvent(UUID.randomUUID(), correlationId, occurredAt, task, recurrence);
  }

  @Override
  public TaskEventType eventType() {
    return TaskEventType.COMPLETED;
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

  public Optional<RecurrenceSnapshot> recurrenceSnapshot() {
    return Optional.ofNullable(recurrence);
  }
}

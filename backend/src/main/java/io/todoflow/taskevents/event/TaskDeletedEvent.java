package io.todoflow.taskevents.event;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** A task was deleted. Carries identifiers only; deletion never creates follow-up work. */
public record TaskDeletedEvent(
    UUID eventId,
    String correlationId,
    Instant occurredAt,
    UUID taskId,
    String userId,
    UUID recurrenceRuleId)
    implements TaskChangeEvent {

  public TaskDeletedEvent {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(correlationId, "correlationId");
    Objects.requireNonNull(occurredAt, "occurredAt");
    Objects.requireNonNull(taskId, "taskId");
    Objects.requireNonNull(userId, "userId");
  }

  public static TaskDeletedEvent of(
      UUID taskId,
      String userId,
      UUID recurrenceRuleId,
      String correlationId,
      Instant occurredAt) {
    return new TaskDeletedEvent(
        UUID.randomUUID(), correlationId, occurredAt, taskId, userId, recurrenceRuleId);
  }

  @Override
  public TaskEventType eventType() {
    return TaskEventType.DELETED;
  }
}

package io.todoflow.taskevents.event;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A change to a task, published after the change commits. Events are immutable; every consumer
 * receives the same value and applies it at most once per consumer id.
 *
 * <p>The partition key is the owning user id, so all events for one user keep their relative
 * order on the broker.
 */
public sealed interface TaskChangeEvent
    permits TaskCreatedEvent, TaskUpdatedEvent, TaskCompletedEvent, TaskDeletedEvent {

  UUID eventId();

  TaskEventType eventType();

  UUID taskId();

  String userId();

  String correlationId();

  Instant occurredAt();

  default String partitionKey() {
    return userId();
  }

  /** Task state after the change. Empty for deletions. */
  default Optional<TaskSnapshot> snapshot() {
    return Optional.empty();
  }

  /** Users the task is shared with, as known by this event. */
  default List<String> sharedWith() {
    return snapshot().map(TaskSnapshot::sharedWith).orElse(List.of());
  }
}

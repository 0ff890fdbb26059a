package io.todoflow.taskevents.event;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/** Task fields carried by created, updated and completed events. */
public record TaskSnapshot(
    UUID taskId,
    String userId,
    String title,
    String description,
    String priority,
    Instant dueDate,
    Integer reminderOffsetMinutes,
    boolean completed,
    Instant completedAt,
    UUID recurrenceRuleId,
    UUID parentTaskId,
    int occurrenceNumber,
    List<String> sharedWith) {

  public TaskSnapshot {
    Objects.requireNonNull(taskId, "taskId");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(title, "title");
    sharedWith = sharedWith == null ? List.of() : List.copyOf(sharedWith);
    if (occurrenceNumber < 1) {
      occurrenceNumber = 1;
    }
  }

  public boolean isRecurring() {
    return recurrenceRuleId != null;
  }
}

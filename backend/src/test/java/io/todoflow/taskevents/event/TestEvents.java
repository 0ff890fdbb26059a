package io.todoflow.taskevents.event;

import io.todoflow.taskevents.recurrence.RecurrenceFrequency;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/** Builders for event fixtures shared by tests across packages. */
public final class TestEvents {

  public static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

  private TestEvents() {}

  public static TaskSnapshot task(String userId, String title) {
    return task(UUID.randomUUID(), userId, title, NOW.plusSeconds(86_400), List.of());
  }

  public static TaskSnapshot task(
      UUID taskId, String userId, String title, Instant dueDate, List<String> sharedWith) {
    return new TaskSnapshot(
        taskId,
        userId,
        title,
        null,
        "MEDIUM",
        dueDate,
        null,
        false,
        null,
        null,
        null,
        1,
        sharedWith);
  }

  public static TaskSnapshot completedInstance(
      UUID taskId,
      String userId,
      UUID ruleId,
      Instant dueDate,
      Instant completedAt,
      int occurrenceNumber) {
    return new TaskSnapshot(
        taskId,
        userId,
        "Water plants",
        null,
        "MEDIUM",
        dueDate,
        null,
        true,
        completedAt,
        ruleId,
        null,
        occurrenceNumber,
        List.of());
  }

  public static RecurrenceSnapshot daily(UUID ruleId, Integer maxOccurrences, LocalDate endDate) {
    return new RecurrenceSnapshot(
        ruleId, RecurrenceFrequency.DAILY, 1, Set.of(), null, endDate, maxOccurrences, null);
  }

  public static RecurrenceSnapshot weekly(UUID ruleId, Set<DayOfWeek> days, int maxOccurrences) {
    return new RecurrenceSnapshot(
        ruleId, RecurrenceFrequency.WEEKLY, 1, days, null, null, maxOccurrences, null);
  }

  public static TaskCreatedEvent created(TaskSnapshot task) {
    return TaskCreatedEvent.of(task, "corr-" + task.taskId(), NOW);
  }
}

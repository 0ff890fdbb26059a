package io.todoflow.taskevents.task;

import io.todoflow.taskevents.recurrence.RecurrenceFrequency;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/** Input for {@link TaskService#createTask}. {@code recurrence} is null for one-off tasks. */
public record TaskDraft(
    String userId,
    String title,
    String description,
    TaskPriority priority,
    Instant dueDate,
    Integer reminderOffsetMinutes,
    List<String> sharedWith,
    RecurrenceRequest recurrence) {

  public record RecurrenceRequest(
      RecurrenceFrequency frequency,
      int interval,
      Set<DayOfWeek> byWeekday,
      Integer byMonthday,
      String rrule,
      LocalDate endDate,
      Integer maxOccurrences) {}
}

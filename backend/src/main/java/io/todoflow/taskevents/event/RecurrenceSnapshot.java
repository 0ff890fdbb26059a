package io.todoflow.taskevents.event;

import io.todoflow.taskevents.recurrence.RecurrenceFrequency;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Set;
import java.util.UUID;

/**
 * Recurrence rule as carried on a completion event. Not validated here: a rule that reaches a
 * consumer in an invalid state is reported by the consumer instead of failing decoding.
 */
public record RecurrenceSnapshot(
    UUID ruleId,
    RecurrenceFrequency frequency,
    int interval,
    Set<DayOfWeek> byWeekday,
    Integer byMonthday,
    LocalDate endDate,
    Integer maxOccurrences,
    String rrule) {

  public RecurrenceSnapshot {
    byWeekday = byWeekday == null ? Set.of() : Set.copyOf(byWeekday);
  }
}

package io.todoflow.taskevents.recurrence;

public enum RecurrenceFrequency {
  DAILY,
  WEEKLY,
  MONTHLY,
  /** Cadence given by an RRULE string. */
  CUSTOM
}

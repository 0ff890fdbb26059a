package io.todoflow.taskevents.recurrence;

import io.todoflow.taskevents.event.RecurrenceSnapshot;
import java.time.LocalDate;
import java.util.Optional;

/** Next-occurrence arithmetic and validation for recurrence rules. */
public final class RecurrenceCalculator {

  private RecurrenceCalculator() {}

  /**
   * Checks that a rule can drive a series: positive interval, a valid cadence for its frequency,
   * and exactly one end condition.
   *
   * @throws IllegalArgumentException describing the first violation found
   */
  public static void validate(RecurrenceSnapshot rule) {
    if (rule.frequency() == null) {
      throw new IllegalArgumentException("Recurrence frequency is required");
    }
    if (rule.interval() < 1) {
      throw new IllegalArgumentException("Interval must be >= 1, got: " + rule.interval());
    }
    boolean hasEndDate = rule.endDate() != null;
    boolean hasMax = rule.maxOccurrences() != null;
    if (hasEndDate == hasMax) {
      throw new IllegalArgumentException(
          "Exactly one of endDate or maxOccurrences must be set (endDate="
              + rule.endDate()
              + ", maxOccurrences="
              + rule.maxOccurrences()
              + ")");
    }
    if (hasMax && rule.maxOccurrences() < 1) {
      throw new IllegalArgumentException(
          "maxOccurrences must be >= 1, got: " + rule.maxOccurrences());
    }
    cadence(rule);
  }

  /** The RRULE equivalent of the rule's frequency fields. */
  public static RRule cadence(RecurrenceSnapshot rule) {
    return switch (rule.frequency()) {
      case DAILY -> new RRule("DAILY", rule.interval());
      case WEEKLY -> new RRule("WEEKLY", rule.interval(), rule.byWeekday(), null);
      case MONTHLY -> new RRule("MONTHLY", rule.interval(), null, rule.byMonthday());
      case CUSTOM -> {
        if (rule.rrule() == null || rule.rrule().isBlank()) {
          throw new IllegalArgumentException("CUSTOM recurrence requires an RRULE");
        }
        yield RRule.parse(rule.rrule());
      }
    };
  }

  /**
   * The first occurrence strictly after {@code after}, or empty when it would fall past the
   * rule's end date.
   */
  public static Optional<LocalDate> nextOccurrence(RecurrenceSnapshot rule, LocalDate after) {
    LocalDate next = cadence(rule).nextAfter(after);
    if (rule.endDate() != null && next.isAfter(rule.endDate())) {
      return Optional.empty();
    }
    return Optional.of(next);
  }

  /** Whether a series whose latest instance has {@code occurrenceNumber} may produce another. */
  public static boolean allowsAnotherAfter(RecurrenceSnapshot rule, int occurrenceNumber) {
    return rule.maxOccurrences() == null || occurrenceNumber < rule.maxOccurrences();
  }
}

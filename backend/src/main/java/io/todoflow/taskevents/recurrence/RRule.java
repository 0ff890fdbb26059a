package io.todoflow.taskevents.recurrence;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Value object representing a simplified RRULE (RFC 5545 subset). Supports DAILY, WEEKLY, MONTHLY,
 * and YEARLY frequencies with an interval multiplier, plus {@code BYDAY} for weekly and {@code
 * BYMONTHDAY} for monthly rules.
 *
 * <p>Format: {@code FREQ=WEEKLY;INTERVAL=2;BYDAY=MO,TH} or {@code FREQ=DAILY} (interval defaults
 * to 1).
 */
public record RRule(String frequency, int interval, Set<DayOfWeek> byDay, Integer byMonthDay) {

  private static final Set<String> SUPPORTED_FREQUENCIES =
      Set.of("DAILY", "WEEKLY", "MONTHLY", "YEARLY");

  private static final Map<String, DayOfWeek> DAY_CODES =
      Map.of(
          "MO", DayOfWeek.MONDAY,
          "TU", DayOfWeek.TUESDAY,
          "WE", DayOfWeek.WEDNESDAY,
          "TH", DayOfWeek.THURSDAY,
          "FR", DayOfWeek.FRIDAY,
          "SA", DayOfWeek.SATURDAY,
          "SU", DayOfWeek.SUNDAY);

  public RRule {
    if (frequency == null || !SUPPORTED_FREQUENCIES.contains(frequency)) {
      throw new IllegalArgumentException("Unsupported frequency: " + frequency);
    }
    if (interval < 1) {
      throw new IllegalArgumentException("Interval must be >= 1, got: " + interval);
    }
    byDay = byDay == null || byDay.isEmpty() ? Set.of() : Set.copyOf(byDay);
    if (byMonthDay != null && (byMonthDay < 1 || byMonthDay > 31)) {
      throw new IllegalArgumentException("BYMONTHDAY must be within 1..31, got: " + byMonthDay);
    }
  }

  public RRule(String frequency, int interval) {
    this(frequency, interval, Set.of(), null);
  }

  /**
   * Parses an RRULE string. Unknown components are ignored.
   *
   * @throws IllegalArgumentException if the format is invalid or frequency is unsupported
   */
  public static RRule parse(String rruleString) {
    if (rruleString == null || rruleString.isBlank()) {
      throw new IllegalArgumentException("RRULE string must not be null or blank");
    }

    String value = rruleString.trim();
    if (value.toUpperCase().startsWith("RRULE:")) {
      value = value.substring("RRULE:".length());
    }

    String freq = null;
    int interval = 1;
    Set<DayOfWeek> byDay = Set.of();
    Integer byMonthDay = null;

    for (String part : value.split(";")) {
      String[] keyValue = part.split("=", 2);
      if (keyValue.length != 2) {
        throw new IllegalArgumentException("Invalid RRULE component: " + part);
      }
      switch (keyValue[0].trim().toUpperCase()) {
        case "FREQ" -> freq = keyValue[1].trim().toUpperCase();
        case "INTERVAL" -> interval = parseInt("INTERVAL", keyValue[1]);
        case "BYDAY" -> byDay = parseDays(keyValue[1]);
        case "BYMONTHDAY" -> byMonthDay = parseInt("BYMONTHDAY", keyValue[1]);
        default -> {
          // COUNT/UNTIL live on the rule itself, not in the cadence
        }
      }
    }

    if (freq == null) {
      throw new IllegalArgumentException("RRULE must contain FREQ component: " + rruleString);
    }

    return new RRule(freq, interval, byDay, byMonthDay);
  }

  /** Parses a comma-separated list of two-letter day codes, e.g. {@code MO,WE,FR}. */
  public static Set<DayOfWeek> parseDays(String codes) {
    if (codes == null || codes.isBlank()) {
      return Set.of();
    }
    Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
    for (String code : codes.split(",")) {
      DayOfWeek day = DAY_CODES.get(code.trim().toUpperCase());
      if (day == null) {
        throw new IllegalArgumentException("Invalid BYDAY value: " + code);
      }
      days.add(day);
    }
    return days;
  }

  /** Formats days as sorted two-letter codes, the inverse of {@link #parseDays}. */
  public static String formatDays(Set<DayOfWeek> days) {
    return days.stream()
        .sorted()
        .map(day -> day.name().substring(0, 2))
        .collect(Collectors.joining(","));
  }

  /**
   * Returns the first date of this rule's series that falls strictly after {@code after}, taking
   * {@code after} as the series start.
   */
  public LocalDate nextAfter(LocalDate after) {
    return switch (frequency) {
      case "DAILY" -> after.plusDays(interval);
      case "WEEKLY" -> byDay.isEmpty() ? after.plusWeeks(interval) : nextListedWeekday(after);
      case "MONTHLY" -> nextMonthDay(after);
      case "YEARLY" -> after.plusYears(interval);
      default -> throw new IllegalStateException("Unexpected frequency: " + frequency);
    };
  }

  private LocalDate nextListedWeekday(LocalDate after) {
    List<DayOfWeek> days = byDay.stream().sorted().toList();
    LocalDate weekStart = after.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    // the week containing `after` and the next active week always hold a candidate
    for (int week = 0; week <= 1; week++) {
      LocalDate start = weekStart.plusWeeks((long) week * interval);
      for (DayOfWeek day : days) {
        LocalDate candidate = start.plusDays(day.getValue() - 1L);
        if (candidate.isAfter(after)) {
          return candidate;
        }
      }
    }
    throw new IllegalStateException("No weekday candidate after " + after);
  }

  private LocalDate nextMonthDay(LocalDate after) {
    int day = byMonthDay != null ? byMonthDay : after.getDayOfMonth();
    YearMonth month = YearMonth.from(after);
    for (int step = 0; step <= 1; step++) {
      YearMonth candidateMonth = month.plusMonths((long) step * interval);
      LocalDate candidate = candidateMonth.atDay(Math.min(day, candidateMonth.lengthOfMonth()));
      if (candidate.isAfter(after)) {
        return candidate;
      }
    }
    throw new IllegalStateException("No month day candidate after " + after);
  }

  private static int parseInt(String component, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid " + component + " value: " + value);
    }
  }
}

package io.todoflow.taskevents.recurrence;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.time.DayOfWeek;
import java.util.Set;

/** Stores weekday sets as RRULE day codes, e.g. {@code MO,WE,FR}. */
@Converter
public class WeekdaySetConverter implements AttributeConverter<Set<DayOfWeek>, String> {

  @Override
  public String convertToDatabaseColumn(Set<DayOfWeek> days) {
    return days == null || days.isEmpty() ? null : RRule.formatDays(days);
  }

  @Override
  public Set<DayOfWeek> convertToEntityAttribute(String codes) {
    return RRule.parseDays(codes);
  }
}

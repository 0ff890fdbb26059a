package io.todoflow.taskevents.recurrence;

import io.todoflow.taskevents.event.RecurrenceSnapshot;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "recurrence_rules")
public class RecurrenceRule {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private String userId;

  @Enumerated(EnumType.STRING)
  @Column(name = "frequency", nullable = false, length = 20)
  private RecurrenceFrequency frequency;

  @Column(name = "recurrence_interval", nullable = false)
  private int interval;

  @Convert(converter = WeekdaySetConverter.class)
  @Column(name = "by_weekday", length = 30)
  private Set<DayOfWeek> byWeekday;

  @Column(name = "by_monthday")
  private Integer byMonthday;

  @Column(name = "rrule", length = 500)
  private String rrule;

  @Column(name = "end_date")
  private LocalDate endDate;

  @Column(name = "max_occurrences")
  private Integer maxOccurrences;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected RecurrenceRule() {}

  /**
   * Creates a validated rule.
   *
   * @throws IllegalArgumentException if the fields do not describe a usable series
   */
  public RecurrenceRule(
      String userId,
      RecurrenceFrequency frequency,
      int interval,
      Set<DayOfWeek> byWeekday,
      Integer byMonthday,
      String rrule,
      LocalDate endDate,
      Integer maxOccurrences,
      Instant createdAt) {
    this.userId = userId;
    this.frequency = frequency;
    this.interval = interval;
    this.byWeekday = byWeekday == null ? Set.of() : Set.copyOf(byWeekday);
    this.byMonthday = byMonthday;
    this.rrule = rrule;
    this.endDate = endDate;
    this.maxOccurrences = maxOccurrences;
    this.createdAt = createdAt;
    RecurrenceCalculator.validate(toSnapshot());
  }

  public RecurrenceSnapshot toSnapshot() {
    return new RecurrenceSnapshot(
        id, frequency, interval, byWeekday, byMonthday, endDate, maxOccurrences, rrule);
  }

  public UUID getId() {
    return id;
  }

  public String getUserId() {
    return userId;
  }

  public RecurrenceFrequency getFrequency() {
    return frequency;
  }

  public int getInterval() {
    return interval;
  }

  public Set<DayOfWeek> getByWeekday() {
    return byWeekday;
  }

  public Integer getByMonthday() {
    return byMonthday;
  }

  public String getRrule() {
    return rrule;
  }

  public LocalDate getEndDate() {
    return endDate;
  }

  public Integer getMaxOccurrences() {
    return maxOccurrences;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}

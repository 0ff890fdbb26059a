package io.todoflow.taskevents.recurrence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RRuleTest {

  @Test
  void parse_weekly_interval2() {
    var rule = RRule.parse("FREQ=WEEKLY;INTERVAL=2");
    assertThat(rule.frequency()).isEqualTo("WEEKLY");
    assertThat(rule.interval()).isEqualTo(2);
  }

  @Test
  void parse_daily_noInterval_defaultsTo1() {
    var rule = RRule.parse("FREQ=DAILY");
    assertThat(rule.interval()).isEqualTo(1);
  }

  @Test
  void parse_acceptsRrulePrefixAndByDay() {
    var rule = RRule.parse("RRULE:FREQ=WEEKLY;BYDAY=MO,WE,FR");
    assertThat(rule.byDay())
        .containsExactlyInAnyOrder(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY);
  }

  @Test
  void parse_ignoresCountAndUntil() {
    var rule = RRule.parse("FREQ=DAILY;COUNT=5;UNTIL=20261231T000000Z");
    assertThat(rule.frequency()).isEqualTo("DAILY");
  }

  @Test
  void parse_invalidFrequency_throws() {
    assertThatThrownBy(() -> RRule.parse("FREQ=HOURLY"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unsupported frequency");
  }

  @Test
  void parse_missingFreq_throws() {
    assertThatThrownBy(() -> RRule.parse("INTERVAL=2"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("FREQ");
  }

  @Test
  void parse_invalidByDay_throws() {
    assertThatThrownBy(() -> RRule.parse("FREQ=WEEKLY;BYDAY=XX"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("BYDAY");
  }

  @Test
  void parse_zeroInterval_throws() {
    assertThatThrownBy(() -> RRule.parse("FREQ=DAILY;INTERVAL=0"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void nextAfter_daily_addsDays() {
    var rule = RRule.parse("FREQ=DAILY;INTERVAL=3");
    assertThat(rule.nextAfter(LocalDate.of(2026, 1, 10))).isEqualTo(LocalDate.of(2026, 1, 13));
  }

  @Test
  void nextAfter_weekly_addsWeeks() {
    var rule = RRule.parse("FREQ=WEEKLY;INTERVAL=2");
    assertThat(rule.nextAfter(LocalDate.of(2026, 1, 5))).isEqualTo(LocalDate.of(2026, 1, 19));
  }

  @Test
  void nextAfter_weeklyByDay_picksNextListedDayInSameWeek() {
    var rule = new RRule("WEEKLY", 1, EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.THURSDAY), null);
    // 2026-03-02 is a Monday
    assertThat(rule.nextAfter(LocalDate.of(2026, 3, 2))).isEqualTo(LocalDate.of(2026, 3, 5));
  }

  @Test
  void nextAfter_weeklyByDay_wrapsToNextActiveWeek() {
    var rule = new RRule("WEEKLY", 2, EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.THURSDAY), null);
    assertThat(rule.nextAfter(LocalDate.of(2026, 3, 5))).isEqualTo(LocalDate.of(2026, 3, 16));
  }

  @Test
  void nextAfter_monthly_clampsToShortMonth() {
    var rule = new RRule("MONTHLY", 1, Set.of(), 31);
    assertThat(rule.nextAfter(LocalDate.of(2026, 1, 31))).isEqualTo(LocalDate.of(2026, 2, 28));
  }

  @Test
  void nextAfter_monthlyByMonthDay_laterInSameMonth() {
    var rule = new RRule("MONTHLY", 1, Set.of(), 20);
    assertThat(rule.nextAfter(LocalDate.of(2026, 4, 10))).isEqualTo(LocalDate.of(2026, 4, 20));
  }

  @Test
  void nextAfter_yearly_leapDay() {
    var rule = RRule.parse("FREQ=YEARLY");
    assertThat(rule.nextAfter(LocalDate.of(2028, 2, 29))).isEqualTo(LocalDate.of(2029, 2, 28));
  }

  @Test
  void formatDays_isInverseOfParseDays() {
    assertThat(RRule.formatDays(RRule.parseDays("fr,mo"))).isEqualTo("MO,FR");
  }
}

package io.todoflow.taskevents.reminder;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.LocalTime;
import org.junit.jupiter.api.Test;

class NotificationPreferenceTest {

  @Test
  void defaults_enableEmailAndPush_withoutQuietHours() {
    var preference = NotificationPreference.defaultsFor("user-1");

    assertThat(preference.enabledChannels())
        .containsExactly(ReminderChannel.EMAIL, ReminderChannel.PUSH);
    assertThat(preference.quietPeriodEnd(Instant.parse("2026-03-02T03:00:00Z"))).isEmpty();
  }

  @Test
  void quietHoursAcrossMidnight_beforeMidnight_endNextMorning() {
    var preference = quiet(LocalTime.of(22, 0), LocalTime.of(7, 0), "UTC");

    assertThat(preference.quietPeriodEnd(Instant.parse("2026-03-02T23:30:00Z")))
        .contains(Instant.parse("2026-03-03T07:00:00Z"));
  }

  @Test
  void quietHoursAcrossMidnight_afterMidnight_endSameMorning() {
    var preference = quiet(LocalTime.of(22, 0), LocalTime.of(7, 0), "UTC");

    assertThat(preference.quietPeriodEnd(Instant.parse("2026-03-03T06:59:00Z")))
        .contains(Instant.parse("2026-03-03T07:00:00Z"));
  }

  @Test
  void quietHours_endIsExclusive() {
    var preference = quiet(LocalTime.of(22, 0), LocalTime.of(7, 0), "UTC");

    assertThat(preference.quietPeriodEnd(Instant.parse("2026-03-03T07:00:00Z"))).isEmpty();
  }

  @Test
  void quietHours_areEvaluatedInUserZone() {
    // 13:00-14:00 in Berlin (UTC+1 in March before DST)
    var preference = quiet(LocalTime.of(13, 0), LocalTime.of(14, 0), "Europe/Berlin");

    assertThat(preference.quietPeriodEnd(Instant.parse("2026-03-02T12:30:00Z")))
        .contains(Instant.parse("2026-03-02T13:00:00Z"));
    assertThat(preference.quietPeriodEnd(Instant.parse("2026-03-02T13:30:00Z"))).isEmpty();
  }

  @Test
  void unknownTimezone_fallsBackToUtc() {
    var preference = quiet(LocalTime.of(1, 0), LocalTime.of(2, 0), "Mars/Olympus");

    assertThat(preference.quietPeriodEnd(Instant.parse("2026-03-02T01:30:00Z")))
        .contains(Instant.parse("2026-03-02T02:00:00Z"));
  }

  @Test
  void disabledChannels_areNotOffered() {
    var preference = new NotificationPreference("user-1", false, true, null, null, "UTC", 10);

    assertThat(preference.enabledChannels()).containsExactly(ReminderChannel.PUSH);
  }

  private static NotificationPreference quiet(LocalTime start, LocalTime end, String zone) {
    return new NotificationPreference("user-1", true, true, start, end, zone, null);
  }
}

package io.todoflow.taskevents.reminder;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Per-user reminder settings. Owned by the user settings surface; this service only reads them.
 * A user without a row gets {@link #defaultsFor(String)}.
 */
@Entity
@Table(name = "notification_preferences")
public class NotificationPreference {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, unique = true)
  private String userId;

  @Column(name = "email_enabled", nullable = false)
  private boolean emailEnabled;

  @Column(name = "push_enabled", nullable = false)
  private boolean pushEnabled;

  @Column(name = "quiet_hours_start")
  private LocalTime quietHoursStart;

  @Column(name = "quiet_hours_end")
  private LocalTime quietHoursEnd;

  @Column(name = "timezone", nullable = false, length = 64)
  private String timezone;

  @Column(name = "default_reminder_offset_minutes")
  private Integer defaultReminderOffsetMinutes;

  protected NotificationPreference() {}

  public NotificationPreference(
      String userId,
      boolean emailEnabled,
      boolean pushEnabled,
      LocalTime quietHoursStart,
      LocalTime quietHoursEnd,
      String timezone,
      Integer defaultReminderOffsetMinutes) {
    this.userId = userId;
    this.emailEnabled = emailEnabled;
    this.pushEnabled = pushEnabled;
    this.quietHoursStart = quietHoursStart;
    this.quietHoursEnd = quietHoursEnd;
    this.timezone = timezone != null ? timezone : "UTC";
    this.defaultReminderOffsetMinutes = defaultReminderOffsetMinutes;
  }

  /** Email and push on, no quiet hours, UTC, configured default offset. */
  public static NotificationPreference defaultsFor(String userId) {
    return new NotificationPreference(userId, true, true, null, null, "UTC", null);
  }

  public Set<String> enabledChannels() {
    Set<String> channels = new LinkedHashSet<>();
    if (emailEnabled) {
      channels.add(ReminderChannel.EMAIL);
    }
    if (pushEnabled) {
      channels.add(ReminderChannel.PUSH);
    }
    return channels;
  }

  public ZoneId zone() {
    try {
      return ZoneId.of(timezone);
    } catch (DateTimeException e) {
      return ZoneOffset.UTC;
    }
  }

  /**
   * If {@code now} falls inside the quiet hours window in the user's zone, returns the instant
   * the window ends. Windows that cross midnight (e.g. 22:00-07:00) are supported.
   */
  public Optional<Instant> quietPeriodEnd(Instant now) {
    if (quietHoursStart == null
        || quietHoursEnd == null
        || quietHoursStart.equals(quietHoursEnd)) {
      return Optional.empty();
    }
    ZoneId zone = zone();
    ZonedDateTime local = now.atZone(zone);
    LocalTime time = local.toLocalTime();

    boolean quiet;
    if (quietHoursEnd.isAfter(quietHoursStart)) {
      quiet = !time.isBefore(quietHoursStart) && time.isBefore(quietHoursEnd);
    } else {
      // Handle midnight wrap
      quiet = !time.isBefore(quietHoursStart) || time.isBefore(quietHoursEnd);
    }
    if (!quiet) {
      return Optional.empty();
    }

    LocalDate endDay = local.toLocalDate();
    if (!time.isBefore(quietHoursEnd)) {
      endDay = endDay.plusDays(1);
    }
    return Optional.of(ZonedDateTime.of(endDay, quietHoursEnd, zone).toInstant());
  }

  public UUID getId() {
    return id;
  }

  public String getUserId() {
    return userId;
  }

  public boolean isEmailEnabled() {
    return emailEnabled;
  }

  public boolean isPushEnabled() {
    return pushEnabled;
  }

  public LocalTime getQuietHoursStart() {
    return quietHoursStart;
  }

  public LocalTime getQuietHoursEnd() {
    return quietHoursEnd;
  }

  public String getTimezone() {
    return timezone;
  }

  public Integer getDefaultReminderOffsetMinutes() {
    return defaultReminderOffsetMinutes;
  }
}

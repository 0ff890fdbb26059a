package io.todoflow.taskevents.reminder;

import io.todoflow.taskevents.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * A planned reminder for one task. {@code scheduledTime} is when the reminder is meant for;
 * {@code nextAttemptAt} is when the sweeper may next pick it up, moved forward by quiet hours and
 * retry backoff.
 */
@Entity
@Table(name = "reminder_schedules")
public class ReminderSchedule {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "task_id", nullable = false)
  private UUID taskId;

  @Column(name = "user_id", nullable = false)
  private String userId;

  @Column(name = "task_title", nullable = false, length = 500)
  private String taskTitle;

  @Column(name = "due_time", nullable = false)
  private Instant dueTime;

  @Column(name = "scheduled_time", nullable = false)
  private Instant scheduledTime;

  @Column(name = "next_attempt_at")
  private Instant nextAttemptAt;

  @Convert(converter = ChannelSetConverter.class)
  @Column(name = "channels", nullable = false, length = 100)
  private Set<String> channels;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ReminderStatus status;

  @Column(name = "attempts", nullable = false)
  private int attempts;

  @Column(name = "last_error", columnDefinition = "TEXT")
  private String lastError;

  @Column(name = "sent_at")
  private Instant sentAt;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ReminderSchedule() {}

  public ReminderSchedule(
      UUID taskId,
      String userId,
      String taskTitle,
      Instant dueTime,
      Instant scheduledTime,
      Set<String> channels,
      Instant now) {
    this.taskId = taskId;
    this.userId = userId;
    this.taskTitle = taskTitle;
    this.dueTime = dueTime;
    this.scheduledTime = scheduledTime;
    this.nextAttemptAt = scheduledTime;
    this.channels = new TreeSet<>(channels);
    this.status = ReminderStatus.PENDING;
    this.createdAt = now;
    this.updatedAt = now;
  }

  public void markSent(Instant now) {
    transitionTo(ReminderStatus.SENT, now);
    this.attempts++;
    this.sentAt = now;
    this.nextAttemptAt = null;
    this.lastError = null;
  }

  /**
   * Records a failed delivery. The reminder is retried at {@code retryAt} until {@code
   * maxAttempts} attempts have been made; after that it stays FAILED for good.
   */
  public void markFailed(String error, Instant now, Instant retryAt, int maxAttempts) {
    transitionTo(ReminderStatus.FAILED, now);
    this.attempts++;
    this.lastError = error;
    this.nextAttemptAt = attempts < maxAttempts ? retryAt : null;
  }

  public void cancel(String reason, Instant now) {
    transitionTo(ReminderStatus.CANCELLED, now);
    this.lastError = reason;
    this.nextAttemptAt = null;
  }

  /** Pushes the next pickup out, e.g. to the end of the user's quiet hours. */
  public void deferUntil(Instant until, Instant now) {
    if (status.isTerminal()) {
      throw new InvalidStateException(
          "Reminder not deferrable", "Reminder " + id + " is " + status);
    }
    this.nextAttemptAt = until;
    this.updatedAt = now;
  }

  public boolean isDue(Instant now, int maxAttempts) {
    return (status == ReminderStatus.PENDING
            || (status == ReminderStatus.FAILED && attempts < maxAttempts))
        && nextAttemptAt != null
        && !nextAttemptAt.isAfter(now);
  }

  public boolean isTerminal(int maxAttempts) {
    return status.isTerminal() || (status == ReminderStatus.FAILED && attempts >= maxAttempts);
  }

  private void transitionTo(ReminderStatus target, Instant now) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid reminder transition",
          "Cannot transition reminder " + id + " from " + status + " to " + target);
    }
    this.status = target;
    this.updatedAt = now;
  }

  public UUID getId() {
    return id;
  }

  public UUID getTaskId() {
    return taskId;
  }

  public String getUserId() {
    return userId;
  }

  public String getTaskTitle() {
    return taskTitle;
  }

  public Instant getDueTime() {
    return dueTime;
  }

  public Instant getScheduledTime() {
    return scheduledTime;
  }

  public Instant getNextAttemptAt() {
    return nextAttemptAt;
  }

  public Set<String> getChannels() {
    return Set.copyOf(channels);
  }

  public ReminderStatus getStatus() {
    return status;
  }

  public int getAttempts() {
    return attempts;
  }

  public String getLastError() {
    return lastError;
  }

  public Instant getSentAt() {
    return sentAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}

package io.todoflow.taskevents.task;

import io.todoflow.taskevents.event.TaskSnapshot;
import io.todoflow.taskevents.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "tasks")
public class Task {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private String userId;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "priority", nullable = false, length = 20)
  private TaskPriority priority;

  @Column(name = "due_date")
  private Instant dueDate;

  @Column(name = "reminder_offset_minutes")
  private Integer reminderOffsetMinutes;

  @Column(name = "completed", nullable = false)
  private boolean completed;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "recurrence_rule_id")
  private UUID recurrenceRuleId;

  @Column(name = "parent_task_id")
  private UUID parentTaskId;

  @Column(name = "occurrence_number", nullable = false)
  private int occurrenceNumber = 1;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "shared_with", columnDefinition = "jsonb")
  private List<String> sharedWith = new ArrayList<>();

  @Column(name = "deleted_at")
  private Instant deletedAt;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Task() {}

  public Task(
      String userId,
      String title,
      String description,
      TaskPriority priority,
      Instant dueDate,
      Integer reminderOffsetMinutes,
      List<String> sharedWith,
      Instant now) {
    this.userId = userId;
    this.title = title;
    this.description = description;
    this.priority = priority != null ? priority : TaskPriority.MEDIUM;
    this.dueDate = dueDate;
    this.reminderOffsetMinutes = reminderOffsetMinutes;
    this.sharedWith = sharedWith != null ? new ArrayList<>(sharedWith) : new ArrayList<>();
    this.createdAt = now;
    this.updatedAt = now;
  }

  /**
   * Applies new field values and returns the names of the fields that actually changed.
   *
   * @throws InvalidStateException if the task is deleted
   */
  public List<String> update(
      String title,
      String description,
      TaskPriority priority,
      Instant dueDate,
      Integer reminderOffsetMinutes,
      List<String> sharedWith,
      Instant now) {
    requireNotDeleted();
    List<String> changed = new ArrayList<>();
    if (title != null && !title.equals(this.title)) {
      this.title = title;
      changed.add("title");
    }
    if (!Objects.equals(description, this.description)) {
      this.description = description;
      changed.add("description");
    }
    if (priority != null && priority != this.priority) {
      this.priority = priority;
      changed.add("priority");
    }
    if (!Objects.equals(dueDate, this.dueDate)) {
      this.dueDate = dueDate;
      changed.add("dueDate");
    }
    if (!Objects.equals(reminderOffsetMinutes, this.reminderOffsetMinutes)) {
      this.reminderOffsetMinutes = reminderOffsetMinutes;
      changed.add("reminderOffsetMinutes");
    }
    if (sharedWith != null && !sharedWith.equals(this.sharedWith)) {
      this.sharedWith = new ArrayList<>(sharedWith);
      changed.add("sharedWith");
    }
    if (!changed.isEmpty()) {
      this.updatedAt = now;
    }
    return changed;
  }

  public void complete(Instant now) {
    requireNotDeleted();
    if (completed) {
      throw new InvalidStateException(
          "Task already completed", "Task " + id + " was completed at " + completedAt);
    }
    this.completed = true;
    this.completedAt = now;
    this.updatedAt = now;
  }

  public void markDeleted(Instant now) {
    requireNotDeleted();
    this.deletedAt = now;
    this.updatedAt = now;
  }

  /** Links this task into a recurring series. */
  public void linkToSeries(UUID recurrenceRuleId, UUID parentTaskId, int occurrenceNumber) {
    this.recurrenceRuleId = recurrenceRuleId;
    this.parentTaskId = parentTaskId;
    this.occurrenceNumber = occurrenceNumber;
  }

  public boolean isDeleted() {
    return deletedAt != null;
  }

  public TaskSnapshot toSnapshot() {
    return new TaskSnapshot(
        id,
        userId,
        title,
        description,
        priority.name(),
        dueDate,
        reminderOffsetMinutes,
        completed,
        completedAt,
        recurrenceRuleId,
        parentTaskId,
        occurrenceNumber,
        sharedWith);
  }

  private void requireNotDeleted() {
    if (deletedAt != null) {
      throw new InvalidStateException("Task deleted", "Task " + id + " has been deleted");
    }
  }

  public UUID getId() {
    return id;
  }

  public String getUserId() {
    return userId;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public TaskPriority getPriority() {
    return priority;
  }

  public Instant getDueDate() {
    return dueDate;
  }

  public Integer getReminderOffsetMinutes() {
    return reminderOffsetMinutes;
  }

  public boolean isCompleted() {
    return completed;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public UUID getRecurrenceRuleId() {
    return recurrenceRuleId;
  }

  public UUID getParentTaskId() {
    return parentTaskId;
  }

  public int getOccurrenceNumber() {
    return occurrenceNumber;
  }

  public List<String> getSharedWith() {
    return List.copyOf(sharedWith);
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}

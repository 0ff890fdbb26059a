package io.todoflow.taskevents.task;

import java.time.Instant;
import java.util.List;

/**
 * Replacement values for a task's editable fields. A null title, priority or sharedWith keeps the
 * current value; a null description, due date or reminder offset clears it.
 */
public record TaskUpdate(
    String title,
    String description,
    TaskPriority priority,
    Instant dueDate,
    Integer reminderOffsetMinutes,
    List<String> sharedWith) {}

package io.todoflow.taskevents.reminder;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** One notification to one user, covering one or more due tasks. */
public record ReminderDelivery(String userId, List<Item> items) {

  public ReminderDelivery {
    items = List.copyOf(items);
  }

  public record Item(UUID reminderId, UUID taskId, String taskTitle, Instant dueTime) {}

  public boolean isBatch() {
    return items.size() > 1;
  }

  public String subject() {
    return isBatch()
        ? items.size() + " tasks are due soon"
        : "Reminder: \"" + items.get(0).taskTitle() + "\" is due soon";
  }
}

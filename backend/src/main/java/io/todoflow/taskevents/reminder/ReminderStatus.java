package io.todoflow.taskevents.reminder;

import java.util.Map;
import java.util.Set;

/** Reminder delivery status with validated transitions. */
public enum ReminderStatus {
  PENDING,
  SENT,
  FAILED,
  CANCELLED;

  private static final Map<ReminderStatus, Set<ReminderStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          PENDING, Set.of(SENT, FAILED, CANCELLED),
          FAILED, Set.of(SENT, FAILED, CANCELLED),
          SENT, Set.of(),
          CANCELLED, Set.of());

  public Set<ReminderStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  public boolean canTransitionTo(ReminderStatus target) {
    return allowedTransitions().contains(target);
  }

  /** SENT and CANCELLED never change again. FAILED is terminal only once retries run out. */
  public boolean isTerminal() {
    return this == SENT || this == CANCELLED;
  }
}

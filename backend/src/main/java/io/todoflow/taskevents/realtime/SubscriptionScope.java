package io.todoflow.taskevents.realtime;

import java.util.Arrays;
import java.util.Optional;

/** Which task updates a connection asked for. */
public enum SubscriptionScope {
  /** Tasks the connected user owns. */
  OWN_TASKS("own_tasks"),
  /** Tasks other users shared with the connected user. */
  SHARED_TASKS("shared_tasks");

  private final String wireName;

  SubscriptionScope(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static Optional<SubscriptionScope> fromWireName(String value) {
    return Arrays.stream(values()).filter(s -> s.wireName.equals(value)).findFirst();
  }
}

package io.todoflow.taskevents.realtime;

import java.util.Map;
import java.util.Set;

public enum ConnectionState {
  CONNECTING,
  OPEN,
  SUBSCRIBED,
  CLOSED;

  private static final Map<ConnectionState, Set<ConnectionState>> ALLOWED_TRANSITIONS =
      Map.of(
          CONNECTING, Set.of(OPEN, CLOSED),
          OPEN, Set.of(SUBSCRIBED, CLOSED),
          SUBSCRIBED, Set.of(SUBSCRIBED, OPEN, CLOSED),
          CLOSED, Set.of());

  public boolean canTransitionTo(ConnectionState target) {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of()).contains(target);
  }

  /** Whether client control messages (subscribe, unsubscribe, ping) are accepted. */
  public boolean acceptsControlMessages() {
    return this == OPEN || this == SUBSCRIBED;
  }
}

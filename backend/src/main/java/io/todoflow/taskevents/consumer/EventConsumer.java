package io.todoflow.taskevents.consumer;

import io.todoflow.taskevents.event.TaskChangeEvent;

/**
 * A service that reacts to task change events. The runner delivers each record of {@link
 * #topic()} at least once; implementations gate their side effects through the idempotency ledger
 * under {@link #consumerId()}.
 */
public interface EventConsumer {

  /** Ledger id; one id per logical consumer. */
  String consumerId();

  /** Broker consumer group the runner joins. */
  String consumerGroup();

  String topic();

  /**
   * Handles one event. Throwing makes the runner redeliver the record, so only throw for failures
   * worth retrying.
   */
  void handle(TaskChangeEvent event);

  default boolean isEnabled() {
    return true;
  }
}

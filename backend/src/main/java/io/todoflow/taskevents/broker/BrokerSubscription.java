package io.todoflow.taskevents.broker;

import java.time.Duration;
import java.util.List;

/**
 * A group member's view of a topic. Not thread-safe: poll, commit and rewind must be called from
 * the thread that owns the subscription.
 */
public interface BrokerSubscription extends AutoCloseable {

  /** Returns the next records of the assigned partitions, waiting up to {@code timeout}. */
  List<BrokerRecord> poll(Duration timeout);

  /** Marks {@code record} and everything before it on its partition as consumed by the group. */
  void commit(BrokerRecord record);

  /** Moves the read position of {@code partition} back to the group's committed offset. */
  void rewind(int partition);

  @Override
  void close();
}

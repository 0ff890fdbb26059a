package io.todoflow.taskevents.broker;

/**
 * Partitioned, at-least-once event log. Records with the same key land on the same partition and
 * are delivered in publish order. Each consumer group tracks its own committed offsets.
 */
public interface EventBroker {

  /**
   * Appends a record to the topic.
   *
   * @throws BrokerUnavailableException when the broker cannot accept the record right now
   */
  BrokerRecord publish(String topic, String key, String payload);

  /** Joins {@code consumerGroup} on {@code topic}; partitions are shared among group members. */
  BrokerSubscription subscribe(String topic, String consumerGroup);
}

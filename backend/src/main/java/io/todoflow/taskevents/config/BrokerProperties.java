package io.todoflow.taskevents.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Broker settings. {@code type} selects the implementation: {@code in-memory} (default) or
 * {@code kafka}.
 */
@ConfigurationProperties("taskflow.broker")
public record BrokerProperties(
    @DefaultValue("in-memory") String type,
    @DefaultValue("8") int partitions,
    @DefaultValue("7d") Duration retention,
    @DefaultValue("task-events") String taskEventsTopic,
    @DefaultValue("task-updates") String taskUpdatesTopic,
    @DefaultValue("500") int maxPollRecords,
    @DefaultValue("5s") Duration sendTimeout) {

  public BrokerProperties {
    if (partitions < 1) {
      throw new IllegalArgumentException("taskflow.broker.partitions must be >= 1");
    }
  }
}

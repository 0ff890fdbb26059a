package io.todoflow.taskevents.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties("taskflow.consumer")
public record ConsumerProperties(
    @DefaultValue("true") boolean autoStartup,
    @DefaultValue("1s") Duration pollTimeout,
    @DefaultValue("4") int workerThreads,
    @DefaultValue("5") int maxHandlerAttempts,
    @DefaultValue("200ms") Duration initialBackoff,
    @DefaultValue("30s") Duration maxBackoff,
    @DefaultValue("true") boolean recurrenceEnabled,
    @DefaultValue("true") boolean reminderEnabled,
    @DefaultValue("true") boolean fanOutEnabled) {

  public Duration backoffFor(int consecutiveFailures) {
    long factor = 1L << Math.min(Math.max(consecutiveFailures - 1, 0), 20);
    Duration candidate = initialBackoff.multipliedBy(factor);
    return candidate.compareTo(maxBackoff) > 0 ? maxBackoff : candidate;
  }
}

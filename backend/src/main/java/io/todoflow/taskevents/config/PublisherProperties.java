package io.todoflow.taskevents.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties("taskflow.publisher")
public record PublisherProperties(
    @DefaultValue("5") int maxAttempts,
    @DefaultValue("500ms") Duration initialBackoff,
    @DefaultValue("30s") Duration maxBackoff,
    @DefaultValue("10000") int queueCapacity) {

  /** Backoff before the given retry attempt (1-based): doubles per attempt, capped. */
  public Duration backoffFor(int attempt) {
    long factor = 1L << Math.min(Math.max(attempt - 1, 0), 20);
    Duration candidate = initialBackoff.multipliedBy(factor);
    return candidate.compareTo(maxBackoff) > 0 ? maxBackoff : candidate;
  }
}

package io.todoflow.taskevents.reminder;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties("taskflow.reminder")
public record ReminderProperties(
    @DefaultValue("30m") Duration defaultOffset,
    @DefaultValue("2m") Duration batchWindow,
    @DefaultValue("500") int scanLimit,
    @DefaultValue("3") int maxAttempts,
    @DefaultValue("1m") Duration retryBackoff) {}

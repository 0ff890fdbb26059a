package io.todoflow.taskevents.broker;

import java.time.Instant;

public record BrokerRecord(
    String topic, int partition, long offset, String key, String payload, Instant timestamp) {}

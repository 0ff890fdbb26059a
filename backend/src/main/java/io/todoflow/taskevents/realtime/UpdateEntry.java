package io.todoflow.taskevents.realtime;

import java.time.Instant;

/** One sequenced update in a user's stream, already rendered as a client message. */
public record UpdateEntry(
    long sequence, SubscriptionScope scope, String message, Instant recordedAt) {}

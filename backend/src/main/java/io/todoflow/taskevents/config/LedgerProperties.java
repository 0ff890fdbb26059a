package io.todoflow.taskevents.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/** Retention must not be shorter than the broker retention, or redelivered events re-apply. */
@ConfigurationProperties("taskflow.ledger")
public record LedgerProperties(@DefaultValue("7d") Duration retention) {}

package io.todoflow.taskevents.logging;

import java.util.UUID;
import org.slf4j.MDC;

/** Correlation ids link a user action to every event and log line it causes. */
public final class CorrelationIds {

  private CorrelationIds() {}

  public static String generate() {
    return UUID.randomUUID().toString();
  }

  /** Returns the correlation id bound to the current thread, or a fresh one. */
  public static String currentOrGenerate() {
    String current = MDC.get(EventLogContext.MDC_CORRELATION_ID);
    return current != null && !current.isBlank() ? current : generate();
  }
}

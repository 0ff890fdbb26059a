package io.todoflow.taskevents.logging;

import org.slf4j.MDC;

/**
 * Binds the correlation id, event id and consumer id of the event being handled to the SLF4J MDC.
 * Closing the context removes the keys again, so use it in a try-with-resources block.
 */
public final class EventLogContext implements AutoCloseable {

  public static final String MDC_CORRELATION_ID = "correlationId";
  public static final String MDC_EVENT_ID = "eventId";
  public static final String MDC_CONSUMER_ID = "consumerId";

  private final String previousCorrelationId;

  private EventLogContext(String correlationId, String eventId, String consumerId) {
    this.previousCorrelationId = MDC.get(MDC_CORRELATION_ID);
    if (correlationId != null) {
      MDC.put(MDC_CORRELATION_ID, correlationId);
    }
    if (eventId != null) {
      MDC.put(MDC_EVENT_ID, eventId);
    }
    if (consumerId != null) {
      MDC.put(MDC_CONSUMER_ID, consumerId);
    }
  }

  public static EventLogContext open(String correlationId, String eventId, String consumerId) {
    return new EventLogContext(correlationId, eventId, consumerId);
  }

  @Override
  public void close() {
    MDC.remove(MDC_EVENT_ID);
    MDC.remove(MDC_CONSUMER_ID);
    if (previousCorrelationId != null) {
      MDC.put(MDC_CORRELATION_ID, previousCorrelationId);
    } else {
      MDC.remove(MDC_CORRELATION_ID);
    }
  }
}

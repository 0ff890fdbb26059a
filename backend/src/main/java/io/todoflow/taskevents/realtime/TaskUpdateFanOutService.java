package io.todoflow.taskevents.realtime;

import io.todoflow.taskevents.config.BrokerProperties;
import io.todoflow.taskevents.config.ConsumerProperties;
import io.todoflow.taskevents.consumer.EventConsumer;
import io.todoflow.taskevents.event.TaskChangeEvent;
import io.todoflow.taskevents.idempotency.IdempotencyLedger;
import io.todoflow.taskevents.idempotency.ProcessingOutcome;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;

/**
 * Pushes task updates to the WebSocket clients connected to this instance. Every instance consumes
 * the updates topic in its own group, so each instance sees every update and pushes it to its own
 * connections.
 *
 * <p>The owner of a task receives it under {@link SubscriptionScope#OWN_TASKS}; users it is shared
 * with receive it under {@link SubscriptionScope#SHARED_TASKS}. Each recipient's update gets the
 * next sequence of that user's stream and is kept for replay.
 */
@Service
public class TaskUpdateFanOutService implements EventConsumer {

  private static final Logger log = LoggerFactory.getLogger(TaskUpdateFanOutService.class);

  public static final String CONSUMER_ID_PREFIX = "websocket-service:";

  private final IdempotencyLedger ledger;
  private final UpdateSequencer sequencer;
  private final ConnectionRegistry registry;
  private final ServerMessages messages;
  private final BrokerProperties brokerProperties;
  private final ConsumerProperties consumerProperties;
  private final Clock clock;
  private final String consumerId;

  public TaskUpdateFanOutService(
      IdempotencyLedger ledger,
      UpdateSequencer sequencer,
      ConnectionRegistry registry,
      ServerMessages messages,
      BrokerProperties brokerProperties,
      ConsumerProperties consumerProperties,
      FanOutProperties fanOutProperties,
      Clock clock) {
    this.ledger = ledger;
    this.sequencer = sequencer;
    this.registry = registry;
    this.messages = messages;
    this.brokerProperties = brokerProperties;
    this.consumerProperties = consumerProperties;
    this.clock = clock;
    String instanceId =
        fanOutProperties.instanceId().isBlank()
            ? UUID.randomUUID().toString()
            : fanOutProperties.instanceId();
    this.consumerId = CONSUMER_ID_PREFIX + instanceId;
  }

  @Override
  public String consumerId() {
    return consumerId;
  }

  @Override
  public String consumerGroup() {
    return consumerId;
  }

  @Override
  public String topic() {
    return brokerProperties.taskUpdatesTopic();
  }

  @Override
  public boolean isEnabled() {
    return consumerProperties.fanOutEnabled();
  }

  /**
   * Records the event in the ledger, then sequences and pushes it. Sequences are assigned only
   * after the ledger transaction has committed; a rolled back attempt buffers nothing.
   */
  @Override
  public void handle(TaskChangeEvent event) {
    Map<String, SubscriptionScope> recipients = new LinkedHashMap<>();
    ProcessingOutcome outcome =
        ledger.processOnce(
            event.eventId(),
            consumerId,
            event.eventType().cloudEventType(),
            () -> recipients.putAll(recipientsOf(event)));
    if (outcome != ProcessingOutcome.APPLIED) {
      return;
    }
    Instant now = clock.instant();
    recipients.forEach(
        (userId, scope) ->
            push(
                userId,
                sequencer.logFor(userId).append(scope, seq -> messages.update(event, seq), now)));
  }

  /**
   * Subscribes a connection and catches it up from {@code lastSeen}. A connection whose send fails
   * is closed.
   */
  public void subscribe(ClientConnection connection, Set<SubscriptionScope> scopes, Long lastSeen) {
    try {
      connection.subscribe(
          scopes, lastSeen, sequencer.logFor(connection.userId()), messages, clock.instant());
    } catch (IOException | RuntimeException e) {
      log.warn(
          "Closing connection {} after failed subscribe: {}",
          connection.connectionId(),
          e.getMessage());
      registry.close(connection, CloseStatus.SERVER_ERROR);
    }
  }

  private static Map<String, SubscriptionScope> recipientsOf(TaskChangeEvent event) {
    Map<String, SubscriptionScope> recipients = new LinkedHashMap<>();
    recipients.put(event.userId(), SubscriptionScope.OWN_TASKS);
    for (String recipient : event.sharedWith()) {
      if (recipient != null && !recipient.isBlank()) {
        recipients.putIfAbsent(recipient, SubscriptionScope.SHARED_TASKS);
      }
    }
    return recipients;
  }

  private void push(String userId, UpdateEntry entry) {
    List<ClientConnection> failed = new ArrayList<>();
    int delivered = 0;
    for (ClientConnection connection : registry.connectionsFor(userId)) {
      try {
        if (connection.deliver(entry)) {
          delivered++;
        }
      } catch (IOException | RuntimeException e) {
        log.warn(
            "Send to connection {} of user {} failed: {}",
            connection.connectionId(),
            userId,
            e.getMessage());
        failed.add(connection);
      }
    }
    failed.forEach(connection -> registry.close(connection, CloseStatus.SESSION_NOT_RELIABLE));
    log.debug(
        "Pushed update sequence={} to {} connection(s) of user {}",
        entry.sequence(),
        delivered,
        userId);
  }
}

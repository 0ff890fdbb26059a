package io.todoflow.taskevents.publisher;

import io.todoflow.taskevents.broker.BrokerException;
import io.todoflow.taskevents.broker.EventBroker;
import io.todoflow.taskevents.config.BrokerProperties;
import io.todoflow.taskevents.config.PublisherProperties;
import io.todoflow.taskevents.event.TaskChangeEvent;
import io.todoflow.taskevents.event.TaskEventCodec;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Publishes task change events to the task-events and task-updates topics once the originating
 * transaction has committed. Never throws to the caller: broker failures park the event in a
 * bounded local queue that {@link #retryPending()} drains with exponential backoff.
 *
 * <p>Per partition key order is preserved: while an event for a key is queued, later events for
 * the same key on the same topic queue up behind it instead of overtaking it.
 */
@Component
public class TaskEventPublisher {

  private static final Logger log = LoggerFactory.getLogger(TaskEventPublisher.class);

  private final EventBroker broker;
  private final TaskEventCodec codec;
  private final PublisherProperties properties;
  private final List<String> topics;
  private final Clock clock;

  // guarded by this
  private final List<PendingPublication> retryQueue = new ArrayList<>();
  // topic|key pairs with a broker call outstanding; guarded by this
  private final Set<String> inFlight = new HashSet<>();

  public TaskEventPublisher(
      EventBroker broker,
      TaskEventCodec codec,
      PublisherProperties properties,
      BrokerProperties brokerProperties,
      Clock clock) {
    this.broker = broker;
    this.codec = codec;
    this.properties = properties;
    this.topics = List.of(brokerProperties.taskEventsTopic(), brokerProperties.taskUpdatesTopic());
    this.clock = clock;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onTaskChanged(TaskChangeEvent event) {
    publish(event);
  }

  public PublishOutcome publish(TaskChangeEvent event) {
    String payload;
    try {
      payload = codec.encode(event);
    } catch (RuntimeException e) {
      log.error("Failed to encode eventId={} type={}", event.eventId(), event.eventType(), e);
      return PublishOutcome.REJECTED;
    }

    PublishOutcome outcome = PublishOutcome.PUBLISHED;
    for (String topic : topics) {
      outcome = outcome.worst(publishTo(topic, event, payload));
    }
    if (outcome == PublishOutcome.PUBLISHED) {
      log.debug(
          "Published eventId={} type={} taskId={} correlationId={}",
          event.eventId(),
          event.eventType().cloudEventType(),
          event.taskId(),
          event.correlationId());
    }
    return outcome;
  }

  private PublishOutcome publishTo(String topic, TaskChangeEvent event, String payload) {
    var pending =
        new PendingPublication(
            event.eventId(),
            event.eventType().cloudEventType(),
            topic,
            event.partitionKey(),
            payload);
    String orderingKey = pending.orderingKey();

    synchronized (this) {
      if (inFlight.contains(orderingKey) || hasQueued(orderingKey)) {
        log.info(
            "Queueing eventId={} topic={} behind earlier events for key={}",
            event.eventId(),
            topic,
            event.partitionKey());
        pending.nextAttemptAt = clock.instant();
        return enqueue(pending, false);
      }
      inFlight.add(orderingKey);
    }

    try {
      broker.publish(topic, event.partitionKey(), payload);
      return PublishOutcome.PUBLISHED;
    } catch (BrokerException e) {
      pending.attempts = 1;
      pending.nextAttemptAt = clock.instant().plus(properties.backoffFor(1));
      log.warn(
          "Publish failed eventId={} topic={} attempt=1; queued for retry",
          event.eventId(),
          topic,
          e);
      synchronized (this) {
        return enqueue(pending, true);
      }
    } finally {
      synchronized (this) {
        inFlight.remove(orderingKey);
      }
    }
  }

  /**
   * Adds to the retry queue. A failed direct publish goes ahead of entries for the same key that
   * were queued while it was in flight.
   */
  private PublishOutcome enqueue(PendingPublication pending, boolean aheadOfSameKey) {
    if (retryQueue.size() >= properties.queueCapacity()) {
      log.error(
          "Retry queue full ({}), dropping eventId={} type={} topic={}",
          retryQueue.size(),
          pending.eventId,
          pending.eventType,
          pending.topic);
      return PublishOutcome.REJECTED;
    }
    int index = aheadOfSameKey ? indexOfHead(pending.orderingKey()) : -1;
    if (index >= 0) {
      retryQueue.add(index, pending);
    } else {
      retryQueue.add(pending);
    }
    return PublishOutcome.QUEUED_FOR_RETRY;
  }

  private boolean hasQueued(String orderingKey) {
    return indexOfHead(orderingKey) >= 0;
  }

  private int indexOfHead(String orderingKey) {
    for (int i = 0; i < retryQueue.size(); i++) {
      if (retryQueue.get(i).orderingKey().equals(orderingKey)) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Retries queued publications whose backoff has elapsed, oldest first per key. A key whose head
   * entry is still waiting or fails again blocks the rest of that key for this round.
   *
   * <p>Only queue bookkeeping happens under the lock; broker calls run outside it, with the keys
   * being drained marked in flight so direct publishes for them queue up instead of waiting.
   *
   * @return number of publications that reached the broker
   */
  @Scheduled(fixedDelayString = "${taskflow.publisher.retry-interval-ms:1000}")
  public int retryPending() {
    Instant now = clock.instant();
    Set<String> claimed = new LinkedHashSet<>();
    synchronized (this) {
      for (PendingPublication pending : retryQueue) {
        String orderingKey = pending.orderingKey();
        if (!inFlight.contains(orderingKey)) {
          claimed.add(orderingKey);
        }
      }
      inFlight.addAll(claimed);
    }

    int published = 0;
    try {
      for (String orderingKey : claimed) {
        published += drain(orderingKey, now);
      }
    } finally {
      synchronized (this) {
        inFlight.removeAll(claimed);
      }
    }
    return published;
  }

  private int drain(String orderingKey, Instant now) {
    int published = 0;
    while (true) {
      PendingPublication pending;
      synchronized (this) {
        int index = indexOfHead(orderingKey);
        pending = index >= 0 ? retryQueue.get(index) : null;
      }
      if (pending == null || pending.nextAttemptAt.isAfter(now)) {
        return published;
      }
      try {
        broker.publish(pending.topic, pending.key, pending.payload);
      } catch (BrokerException e) {
        synchronized (this) {
          recordFailure(pending, now, e);
        }
        return published;
      }
      synchronized (this) {
        retryQueue.remove(pending);
      }
      published++;
      log.info(
          "Published queued eventId={} topic={} after {} failed attempts",
          pending.eventId,
          pending.topic,
          pending.attempts);
    }
  }

  private void recordFailure(PendingPublication pending, Instant now, BrokerException e) {
    pending.attempts++;
    if (pending.attempts >= properties.maxAttempts()) {
      retryQueue.remove(pending);
      log.error(
          "Durability warning: giving up on eventId={} type={} topic={} key={} after {}"
              + " attempts; the event is lost",
          pending.eventId,
          pending.eventType,
          pending.topic,
          pending.key,
          pending.attempts,
          e);
    } else {
      pending.nextAttemptAt = now.plus(properties.backoffFor(pending.attempts));
      log.warn(
          "Retry failed eventId={} topic={} attempt={} nextAttemptAt={}",
          pending.eventId,
          pending.topic,
          pending.attempts,
          pending.nextAttemptAt);
    }
  }

  public synchronized int pendingCount() {
    return retryQueue.size();
  }

  private static final class PendingPublication {

    private final UUID eventId;
    private final String eventType;
    private final String topic;
    private final String key;
    private final String payload;
    private int attempts;
    private Instant nextAttemptAt;

    private PendingPublication(
        UUID eventId, String eventType, String topic, String key, String payload) {
      this.eventId = eventId;
      this.eventType = eventType;
      this.topic = topic;
      this.key = key;
      this.payload = payload;
    }

    private String orderingKey() {
      return topic + "|" + key;
    }
  }
}

package io.todoflow.taskevents.consumer;

import io.todoflow.taskevents.broker.BrokerException;
import io.todoflow.taskevents.broker.BrokerRecord;
import io.todoflow.taskevents.broker.BrokerSubscription;
import io.todoflow.taskevents.broker.EventBroker;
import io.todoflow.taskevents.config.ConsumerProperties;
import io.todoflow.taskevents.event.MalformedEventException;
import io.todoflow.taskevents.event.TaskChangeEvent;
import io.todoflow.taskevents.event.TaskEventCodec;
import io.todoflow.taskevents.logging.EventLogContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Poll loop for one consumer. Each polled batch is split by partition; partitions run
 * concurrently on the shared executor while records of one partition run strictly in offset
 * order. Offsets are committed from the polling thread once the batch settles.
 *
 * <p>A handler failure stops its partition for the batch and rewinds it, so the failed record and
 * everything after it on that partition are redelivered. A record that keeps failing is
 * dead-lettered after {@code maxHandlerAttempts}.
 */
class ConsumerWorker implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(ConsumerWorker.class);

  private final EventConsumer consumer;
  private final EventBroker broker;
  private final TaskEventCodec codec;
  private final DeadLetterService deadLetterService;
  private final ConsumerProperties properties;
  private final ExecutorService partitionExecutor;
  private final Map<String, Integer> failedAttempts = new ConcurrentHashMap<>();

  private volatile boolean running = true;
  private BrokerSubscription subscription;
  private int consecutiveBrokerFailures;

  ConsumerWorker(
      EventConsumer consumer,
      EventBroker broker,
      TaskEventCodec codec,
      DeadLetterService deadLetterService,
      ConsumerProperties properties,
      ExecutorService partitionExecutor) {
    this.consumer = consumer;
    this.broker = broker;
    this.codec = codec;
    this.deadLetterService = deadLetterService;
    this.properties = properties;
    this.partitionExecutor = partitionExecutor;
  }

  @Override
  public void run() {
    log.info(
        "Consumer started consumerId={} group={} topic={}",
        consumer.consumerId(),
        consumer.consumerGroup(),
        consumer.topic());
    try {
      while (running && !Thread.currentThread().isInterrupted()) {
        pollOnce();
      }
    } finally {
      closeSubscription();
      log.info("Consumer stopped consumerId={}", consumer.consumerId());
    }
  }

  void stop() {
    running = false;
  }

  /** Polls and processes one batch. Returns the number of records that settled. */
  int pollOnce() {
    List<BrokerRecord> records;
    try {
      if (subscription == null) {
        subscription = broker.subscribe(consumer.topic(), consumer.consumerGroup());
      }
      records = subscription.poll(properties.pollTimeout());
      consecutiveBrokerFailures = 0;
    } catch (BrokerException e) {
      onBrokerFailure(e);
      return 0;
    }
    if (records.isEmpty()) {
      return 0;
    }

    Map<Integer, List<BrokerRecord>> byPartition = new LinkedHashMap<>();
    for (BrokerRecord record : records) {
      byPartition.computeIfAbsent(record.partition(), p -> new ArrayList<>()).add(record);
    }

    List<PartitionResult> results = processPartitions(byPartition);

    int settled = 0;
    boolean anyFailed = false;
    for (PartitionResult result : results) {
      settled += result.settled();
      try {
        if (result.lastSettled() != null) {
          subscription.commit(result.lastSettled());
        }
        if (result.failed()) {
          anyFailed = true;
          subscription.rewind(result.partition());
        }
      } catch (BrokerException e) {
        log.warn(
            "Offset commit failed consumerId={} partition={}; records will be redelivered",
            consumer.consumerId(),
            result.partition(),
            e);
      }
    }
    if (anyFailed) {
      sleep(properties.initialBackoff());
    }
    return settled;
  }

  private List<PartitionResult> processPartitions(Map<Integer, List<BrokerRecord>> byPartition) {
    if (byPartition.size() == 1 || partitionExecutor == null) {
      List<PartitionResult> results = new ArrayList<>();
      byPartition.forEach((partition, batch) -> results.add(processPartition(partition, batch)));
      return results;
    }

    Map<Integer, Future<PartitionResult>> futures = new LinkedHashMap<>();
    byPartition.forEach(
        (partition, batch) ->
            futures.put(
                partition, partitionExecutor.submit(() -> processPartition(partition, batch))));

    List<PartitionResult> results = new ArrayList<>();
    for (var entry : futures.entrySet()) {
      try {
        results.add(entry.getValue().get());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        running = false;
        results.add(new PartitionResult(entry.getKey(), null, 0, true));
      } catch (ExecutionException e) {
        log.error(
            "Partition worker crashed consumerId={} partition={}",
            consumer.consumerId(),
            entry.getKey(),
            e.getCause());
        results.add(new PartitionResult(entry.getKey(), null, 0, true));
      }
    }
    return results;
  }

  private PartitionResult processPartition(int partition, List<BrokerRecord> batch) {
    BrokerRecord lastSettled = null;
    int settled = 0;
    for (BrokerRecord record : batch) {
      if (!process(record)) {
        return new PartitionResult(partition, lastSettled, settled, true);
      }
      lastSettled = record;
      settled++;
    }
    return new PartitionResult(partition, lastSettled, settled, false);
  }

  /** Returns true when the record is settled: applied, skipped, or dead-lettered. */
  private boolean process(BrokerRecord record) {
    TaskChangeEvent event;
    try {
      event = codec.decode(record.payload());
    } catch (MalformedEventException e) {
      log.warn(
          "Malformed event consumerId={} topic={} partition={} offset={}: {}",
          consumer.consumerId(),
          record.topic(),
          record.partition(),
          record.offset(),
          e.getMessage());
      return deadLetter(record, "malformed event: " + e.getMessage());
    }

    try (var ignored =
        EventLogContext.open(
            event.correlationId(), event.eventId().toString(), consumer.consumerId())) {
      try {
        consumer.handle(event);
        failedAttempts.remove(attemptKey(record));
        return true;
      } catch (RuntimeException e) {
        int attempts = failedAttempts.merge(attemptKey(record), 1, Integer::sum);
        if (attempts >= properties.maxHandlerAttempts()) {
          log.error(
              "Handler failed {} times, dead-lettering eventId={} type={} offset={}",
              attempts,
              event.eventId(),
              event.eventType(),
              record.offset(),
              e);
          if (deadLetter(record, "handler failed after " + attempts + " attempts: " + e)) {
            failedAttempts.remove(attemptKey(record));
            return true;
          }
          return false;
        }
        log.warn(
            "Handler failed attempt={} eventId={} type={} offset={}; will redeliver",
            attempts,
            event.eventId(),
            event.eventType(),
            record.offset(),
            e);
        return false;
      }
    }
  }

  private boolean deadLetter(BrokerRecord record, String reason) {
    try {
      deadLetterService.record(consumer.consumerId(), record, reason);
      return true;
    } catch (RuntimeException e) {
      log.error(
          "Failed to store dead letter consumerId={} partition={} offset={}",
          consumer.consumerId(),
          record.partition(),
          record.offset(),
          e);
      return false;
    }
  }

  private void onBrokerFailure(BrokerException e) {
    consecutiveBrokerFailures++;
    Duration backoff = properties.backoffFor(consecutiveBrokerFailures);
    log.warn(
        "Broker unavailable consumerId={} failures={} retryIn={}",
        consumer.consumerId(),
        consecutiveBrokerFailures,
        backoff,
        e);
    closeSubscription();
    sleep(backoff);
  }

  private void closeSubscription() {
    // partitions may move to another member once the subscription is gone
    failedAttempts.clear();
    if (subscription == null) {
      return;
    }
    try {
      subscription.close();
    } catch (RuntimeException e) {
      log.warn("Failed to close subscription consumerId={}", consumer.consumerId(), e);
    }
    subscription = null;
  }

  private void sleep(Duration duration) {
    if (!running) {
      return;
    }
    try {
      Thread.sleep(duration.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      running = false;
    }
  }

  private static String attemptKey(BrokerRecord record) {
    return record.topic() + "/" + record.partition() + "/" + record.offset();
  }

  private record PartitionResult(
      int partition, BrokerRecord lastSettled, int settled, boolean failed) {}
}

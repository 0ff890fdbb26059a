package io.todoflow.taskevents.consumer;

import io.todoflow.taskevents.broker.EventBroker;
import io.todoflow.taskevents.config.ConsumerProperties;
import io.todoflow.taskevents.event.TaskEventCodec;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

/**
 * Starts one polling thread per enabled {@link EventConsumer} once the context is up and stops
 * them on shutdown. Partition work of all consumers shares one bounded worker pool.
 */
@Component
public class ConsumerRunner implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(ConsumerRunner.class);

  private static final long STOP_TIMEOUT_MS = 10_000;

  private final List<EventConsumer> consumers;
  private final EventBroker broker;
  private final TaskEventCodec codec;
  private final DeadLetterService deadLetterService;
  private final ConsumerProperties properties;

  private final List<ConsumerWorker> workers = new ArrayList<>();
  private final List<Thread> threads = new ArrayList<>();
  private ExecutorService partitionExecutor;
  private volatile boolean running;

  public ConsumerRunner(
      List<EventConsumer> consumers,
      EventBroker broker,
      TaskEventCodec codec,
      DeadLetterService deadLetterService,
      ConsumerProperties properties) {
    this.consumers = consumers;
    this.broker = broker;
    this.codec = codec;
    this.deadLetterService = deadLetterService;
    this.properties = properties;
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    partitionExecutor =
        Executors.newFixedThreadPool(
            Math.max(1, properties.workerThreads()),
            new CustomizableThreadFactory("consumer-partition-"));
    for (EventConsumer consumer : consumers) {
      if (!consumer.isEnabled()) {
        log.info("Consumer disabled consumerId={}", consumer.consumerId());
        continue;
      }
      var worker =
          new ConsumerWorker(
              consumer, broker, codec, deadLetterService, properties, partitionExecutor);
      var thread = new Thread(worker, "consumer-" + consumer.consumerId());
      thread.setDaemon(true);
      workers.add(worker);
      threads.add(thread);
      thread.start();
    }
    running = true;
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    workers.forEach(ConsumerWorker::stop);
    for (Thread thread : threads) {
      try {
        thread.join(STOP_TIMEOUT_MS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
      if (thread.isAlive()) {
        log.warn("Consumer thread {} did not stop in time, interrupting", thread.getName());
        thread.interrupt();
      }
    }
    partitionExecutor.shutdown();
    try {
      if (!partitionExecutor.awaitTermination(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
        partitionExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      partitionExecutor.shutdownNow();
    }
    workers.clear();
    threads.clear();
    running = false;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public boolean isAutoStartup() {
    return properties.autoStartup();
  }
}

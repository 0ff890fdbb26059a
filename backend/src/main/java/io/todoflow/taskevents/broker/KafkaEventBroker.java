package io.todoflow.taskevents.broker;

import io.todoflow.taskevents.config.BrokerProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Kafka-backed broker. Records are keyed by the partition key so Kafka's default partitioner keeps
 * per-user order; subscriptions use manual offset commits.
 */
@Component
@ConditionalOnProperty(name = "taskflow.broker.type", havingValue = "kafka")
public class KafkaEventBroker implements EventBroker {

  private static final Logger log = LoggerFactory.getLogger(KafkaEventBroker.class);

  private final KafkaTemplate<String, String> kafkaTemplate;
  private final ConsumerFactory<String, String> consumerFactory;
  private final BrokerProperties properties;

  public KafkaEventBroker(
      KafkaTemplate<String, String> kafkaTemplate,
      ConsumerFactory<String, String> consumerFactory,
      BrokerProperties properties) {
    this.kafkaTemplate = kafkaTemplate;
    this.consumerFactory = consumerFactory;
    this.properties = properties;
  }

  @Override
  public BrokerRecord publish(String topic, String key, String payload) {
    try {
      var result =
          kafkaTemplate
              .send(topic, key, payload)
              .get(properties.sendTimeout().toMillis(), TimeUnit.MILLISECONDS);
      var metadata = result.getRecordMetadata();
      return new BrokerRecord(
          topic,
          metadata.partition(),
          metadata.offset(),
          key,
          payload,
          Instant.ofEpochMilli(metadata.timestamp()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BrokerUnavailableException("Interrupted while publishing to " + topic, e);
    } catch (ExecutionException | TimeoutException | KafkaException e) {
      throw new BrokerUnavailableException("Failed to publish to " + topic, e);
    }
  }

  @Override
  public BrokerSubscription subscribe(String topic, String consumerGroup) {
    var overrides = new Properties();
    overrides.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
    overrides.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
    overrides.put(
        ConsumerConfig.MAX_POLL_RECORDS_CONFIG, String.valueOf(properties.maxPollRecords()));
    try {
      Consumer<String, String> consumer =
          consumerFactory.createConsumer(
              consumerGroup, consumerGroup, "-" + UUID.randomUUID(), overrides);
      consumer.subscribe(List.of(topic));
      log.info("Kafka subscription created topic={} group={}", topic, consumerGroup);
      return new KafkaSubscription(consumer);
    } catch (KafkaException e) {
      throw new BrokerUnavailableException("Failed to subscribe to " + topic, e);
    }
  }

  private static final class KafkaSubscription implements BrokerSubscription {

    private final Consumer<String, String> consumer;

    private KafkaSubscription(Consumer<String, String> consumer) {
      this.consumer = consumer;
    }

    @Override
    public List<BrokerRecord> poll(Duration timeout) {
      try {
        var polled = consumer.poll(timeout);
        List<BrokerRecord> records = new ArrayList<>(polled.count());
        for (ConsumerRecord<String, String> record : polled) {
          records.add(
              new BrokerRecord(
                  record.topic(),
                  record.partition(),
                  record.offset(),
                  record.key(),
                  record.value(),
                  Instant.ofEpochMilli(record.timestamp())));
        }
        return records;
      } catch (KafkaException e) {
        throw new BrokerUnavailableException("Kafka poll failed", e);
      }
    }

    @Override
    public void commit(BrokerRecord record) {
      try {
        consumer.commitSync(
            Map.of(
                new TopicPartition(record.topic(), record.partition()),
                new OffsetAndMetadata(record.offset() + 1)));
      } catch (KafkaException e) {
        throw new BrokerUnavailableException("Kafka commit failed", e);
      }
    }

    @Override
    public void rewind(int partition) {
      var assigned =
          consumer.assignment().stream().filter(tp -> tp.partition() == partition).toList();
      for (TopicPartition tp : assigned) {
        try {
          OffsetAndMetadata committed = consumer.committed(Set.of(tp)).get(tp);
          if (committed != null) {
            consumer.seek(tp, committed.offset());
          } else {
            consumer.seekToBeginning(List.of(tp));
          }
        } catch (KafkaException e) {
          throw new BrokerUnavailableException("Kafka seek failed for " + tp, e);
        }
      }
    }

    @Override
    public void close() {
      consumer.close();
    }
  }
}

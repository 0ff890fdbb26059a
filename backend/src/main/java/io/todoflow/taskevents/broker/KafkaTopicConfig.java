package io.todoflow.taskevents.broker;

import io.todoflow.taskevents.config.BrokerProperties;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/** Declares the task topics so the admin client creates them with the configured partitions. */
@Configuration
@ConditionalOnProperty(name = "taskflow.broker.type", havingValue = "kafka")
public class KafkaTopicConfig {

  private final BrokerProperties properties;

  public KafkaTopicConfig(BrokerProperties properties) {
    this.properties = properties;
  }

  @Bean
  NewTopic taskEventsTopic() {
    return TopicBuilder.name(properties.taskEventsTopic())
        .partitions(properties.partitions())
        .config("retention.ms", String.valueOf(properties.retention().toMillis()))
        .build();
  }

  @Bean
  NewTopic taskUpdatesTopic() {
    return TopicBuilder.name(properties.taskUpdatesTopic())
        .partitions(properties.partitions())
        .config("retention.ms", String.valueOf(properties.retention().toMillis()))
        .build();
  }
}

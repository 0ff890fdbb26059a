package io.todoflow.taskevents.config;

import io.todoflow.taskevents.realtime.FanOutProperties;
import io.todoflow.taskevents.reminder.ReminderProperties;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
  BrokerProperties.class,
  PublisherProperties.class,
  ConsumerProperties.class,
  LedgerProperties.class,
  ReminderProperties.class,
  FanOutProperties.class
})
public class EventCoreConfig implements InitializingBean {

  private static final Logger log = LoggerFactory.getLogger(EventCoreConfig.class);

  private final BrokerProperties brokerProperties;
  private final LedgerProperties ledgerProperties;

  public EventCoreConfig(BrokerProperties brokerProperties, LedgerProperties ledgerProperties) {
    this.brokerProperties = brokerProperties;
    this.ledgerProperties = ledgerProperties;
  }

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Override
  public void afterPropertiesSet() {
    if (ledgerProperties.retention().compareTo(brokerProperties.retention()) < 0) {
      log.warn(
          "Ledger retention {} is shorter than broker retention {}; redelivered events older"
              + " than the ledger window would be applied twice",
          ledgerProperties.retention(),
          brokerProperties.retention());
    }
  }
}

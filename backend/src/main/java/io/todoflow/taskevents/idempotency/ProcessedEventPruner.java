package io.todoflow.taskevents.idempotency;

import io.todoflow.taskevents.config.LedgerProperties;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Deletes ledger rows older than the ledger retention window. */
@Component
public class ProcessedEventPruner {

  private static final Logger log = LoggerFactory.getLogger(ProcessedEventPruner.class);

  private final ProcessedEventRepository repository;
  private final LedgerProperties properties;
  private final Clock clock;

  public ProcessedEventPruner(
      ProcessedEventRepository repository, LedgerProperties properties, Clock clock) {
    this.repository = repository;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(cron = "${taskflow.ledger.prune-cron:0 0 * * * *}")
  @Transactional
  public int prune() {
    var cutoff = clock.instant().minus(properties.retention());
    int deleted = repository.deleteProcessedBefore(cutoff);
    if (deleted > 0) {
      log.info("Pruned {} processed event records older than {}", deleted, cutoff);
    }
    return deleted;
  }
}

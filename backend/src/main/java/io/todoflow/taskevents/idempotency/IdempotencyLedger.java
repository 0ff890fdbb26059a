package io.todoflow.taskevents.idempotency;

import java.time.Clock;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Applies an event's side effects at most once per consumer id. The ledger check, the ledger
 * insert and the handler run in one transaction: if the handler fails nothing is recorded and the
 * event is applied again on redelivery; if it succeeds the ledger row commits with its effects.
 */
@Service
public class IdempotencyLedger {

  private static final Logger log = LoggerFactory.getLogger(IdempotencyLedger.class);

  private final ProcessedEventRepository repository;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public IdempotencyLedger(
      ProcessedEventRepository repository, TransactionTemplate transactionTemplate, Clock clock) {
    this.repository = repository;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  public ProcessingOutcome processOnce(UUID eventId, String consumerId, Runnable handler) {
    return processOnce(eventId, consumerId, null, handler);
  }

  /**
   * Runs {@code handler} unless {@code (eventId, consumerId)} is already in the ledger.
   *
   * @throws RuntimeException whatever the handler threw; the transaction is rolled back
   */
  public ProcessingOutcome processOnce(
      UUID eventId, String consumerId, String eventType, Runnable handler) {
    var id = new ProcessedEventId(eventId, consumerId);
    try {
      ProcessingOutcome outcome =
          transactionTemplate.execute(
              tx -> {
                if (repository.existsById(id)) {
                  return ProcessingOutcome.SKIPPED_ALREADY_PROCESSED;
                }
                try {
                  repository.saveAndFlush(new ProcessedEvent(id, eventType, clock.instant()));
                } catch (DataIntegrityViolationException e) {
                  throw new ConcurrentDuplicateException(e);
                }
                handler.run();
                return ProcessingOutcome.APPLIED;
              });
      if (outcome == ProcessingOutcome.SKIPPED_ALREADY_PROCESSED) {
        log.info("SkippedAlreadyProcessed eventId={} consumerId={}", eventId, consumerId);
      }
      return outcome;
    } catch (ConcurrentDuplicateException e) {
      log.info(
          "SkippedAlreadyProcessed eventId={} consumerId={} (concurrent duplicate)",
          eventId,
          consumerId);
      return ProcessingOutcome.SKIPPED_ALREADY_PROCESSED;
    }
  }

  private static final class ConcurrentDuplicateException extends RuntimeException {

    private ConcurrentDuplicateException(Throwable cause) {
      super(cause);
    }
  }
}

package io.todoflow.taskevents.consumer;

import io.todoflow.taskevents.broker.BrokerRecord;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DeadLetterService {

  private static final Logger log = LoggerFactory.getLogger(DeadLetterService.class);

  private static final int MAX_REASON_LENGTH = 2000;

  private final DeadLetterEventRepository repository;
  private final Clock clock;

  public DeadLetterService(DeadLetterEventRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public DeadLetterEvent record(String consumerId, BrokerRecord record, String reason) {
    String trimmed =
        reason != null && reason.length() > MAX_REASON_LENGTH
            ? reason.substring(0, MAX_REASON_LENGTH)
            : reason;
    var deadLetter =
        repository.save(
            new DeadLetterEvent(
                consumerId,
                record.topic(),
                record.partition(),
                record.offset(),
                record.key(),
                trimmed != null ? trimmed : "unknown",
                record.payload(),
                clock.instant()));
    log.warn(
        "Dead-lettered record consumerId={} topic={} partition={} offset={} reason={}",
        consumerId,
        record.topic(),
        record.partition(),
        record.offset(),
        trimmed);
    return deadLetter;
  }
}

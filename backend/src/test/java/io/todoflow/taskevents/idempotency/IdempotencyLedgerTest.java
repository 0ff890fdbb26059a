package io.todoflow.taskevents.idempotency;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.todoflow.taskevents.MutableClock;
import io.todoflow.taskevents.event.TestEvents;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class IdempotencyLedgerTest {

  private static final String CONSUMER = "recurrence-service";

  @Mock private ProcessedEventRepository repository;
  @Mock private PlatformTransactionManager transactionManager;

  private IdempotencyLedger ledger;
  private final AtomicInteger applied = new AtomicInteger();

  @BeforeEach
  void setUp() {
    ledger =
        new IdempotencyLedger(
            repository,
            new TransactionTemplate(transactionManager),
            new MutableClock(TestEvents.NOW));
  }

  @Test
  void firstDelivery_recordsAndApplies() {
    var eventId = UUID.randomUUID();
    var id = new ProcessedEventId(eventId, CONSUMER);
    when(repository.existsById(id)).thenReturn(false);

    var outcome = ledger.processOnce(eventId, CONSUMER, "task.completed", applied::incrementAndGet);

    assertThat(outcome).isEqualTo(ProcessingOutcome.APPLIED);
    assertThat(applied).hasValue(1);
    var captor = ArgumentCaptor.forClass(ProcessedEvent.class);
    verify(repository).saveAndFlush(captor.capture());
    assertThat(captor.getValue().getId()).isEqualTo(id);
    assertThat(captor.getValue().getEventType()).isEqualTo("task.completed");
    assertThat(captor.getValue().getProcessedAt()).isEqualTo(TestEvents.NOW);
  }

  @Test
  void redelivery_isSkipped() {
    var eventId = UUID.randomUUID();
    when(repository.existsById(new ProcessedEventId(eventId, CONSUMER))).thenReturn(true);

    var outcome = ledger.processOnce(eventId, CONSUMER, applied::incrementAndGet);

    assertThat(outcome).isEqualTo(ProcessingOutcome.SKIPPED_ALREADY_PROCESSED);
    assertThat(applied).hasValue(0);
    verify(repository, never()).saveAndFlush(any());
  }

  @Test
  void concurrentDuplicateInsert_isSkippedAndRolledBack() {
    var eventId = UUID.randomUUID();
    when(repository.existsById(any())).thenReturn(false);
    when(repository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("pk"));

    var outcome = ledger.processOnce(eventId, CONSUMER, applied::incrementAndGet);

    assertThat(outcome).isEqualTo(ProcessingOutcome.SKIPPED_ALREADY_PROCESSED);
    assertThat(applied).hasValue(0);
    verify(transactionManager).rollback(any());
  }

  @Test
  void handlerFailure_propagatesAndRollsBack() {
    when(repository.existsById(any())).thenReturn(false);

    assertThatThrownBy(
            () ->
                ledger.processOnce(
                    UUID.randomUUID(),
                    CONSUMER,
                    () -> {
                      throw new IllegalStateException("side effect failed");
                    }))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("side effect failed");
    verify(transactionManager).rollback(any());
    verify(transactionManager, never()).commit(any());
  }

  @Test
  void sameEvent_differentConsumers_areIndependent() {
    var eventId = UUID.randomUUID();
    when(repository.existsById(new ProcessedEventId(eventId, CONSUMER))).thenReturn(true);
    when(repository.existsById(new ProcessedEventId(eventId, "reminder-service")))
        .thenReturn(false);

    assertThat(ledger.processOnce(eventId, CONSUMER, applied::incrementAndGet))
        .isEqualTo(ProcessingOutcome.SKIPPED_ALREADY_PROCESSED);
    assertThat(ledger.processOnce(eventId, "reminder-service", applied::incrementAndGet))
        .isEqualTo(ProcessingOutcome.APPLIED);
    assertThat(applied).hasValue(1);
  }
}

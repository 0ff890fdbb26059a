package io.todoflow.taskevents.recurrence;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.todoflow.taskevents.config.BrokerProperties;
import io.todoflow.taskevents.config.ConsumerProperties;
import io.todoflow.taskevents.event.RecurrenceSnapshot;
import io.todoflow.taskevents.event.TaskCompletedEvent;
import io.todoflow.taskevents.event.TaskDeletedEvent;
import io.todoflow.taskevents.event.TestEvents;
import io.todoflow.taskevents.idempotency.IdempotencyLedger;
import io.todoflow.taskevents.idempotency.ProcessingOutcome;
import io.todoflow.taskevents.task.TaskService;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RecurrenceMaterializerTest {

  private static final UUID RULE_ID = UUID.randomUUID();

  @Mock private IdempotencyLedger ledger;
  @Mock private TaskService taskService;

  private RecurrenceMaterializer materializer;

  @BeforeEach
  void setUp() {
    materializer =
        new RecurrenceMaterializer(
            ledger,
            taskService,
            new BrokerProperties(
                "in-memory",
                8,
                Duration.ofDays(7),
                "task-events",
                "task-updates",
                500,
                Duration.ofSeconds(5)),
            new ConsumerProperties(
                true,
                Duration.ofSeconds(1),
                1,
                5,
                Duration.ofMillis(1),
                Duration.ofMillis(1),
                true,
                true,
                true));
  }

  @Test
  void dailySeries_createsNextInstanceAtParentTimeOfDay() {
    applyThroughLedger();
    var event =
        completed(
            "2026-03-02T08:00:00Z", "2026-03-02T10:15:00Z", 1, TestEvents.daily(RULE_ID, 3, null));

    materializer.handle(event);

    verify(taskService)
        .createRecurringInstance(event.taskId(), Instant.parse("2026-03-03T08:00:00Z"));
  }

  @Test
  void completedLate_anchorsOnCompletionDate() {
    applyThroughLedger();
    var event =
        completed(
            "2026-03-01T08:00:00Z", "2026-03-04T21:00:00Z", 1, TestEvents.daily(RULE_ID, 5, null));

    materializer.handle(event);

    verify(taskService)
        .createRecurringInstance(event.taskId(), Instant.parse("2026-03-05T08:00:00Z"));
  }

  @Test
  void completedEarly_neverSchedulesBeforeOriginalDueDate() {
    applyThroughLedger();
    var event =
        completed(
            "2026-03-10T08:00:00Z", "2026-03-02T07:00:00Z", 1, TestEvents.daily(RULE_ID, 5, null));

    materializer.handle(event);

    verify(taskService)
        .createRecurringInstance(event.taskId(), Instant.parse("2026-03-11T08:00:00Z"));
  }

  @Test
  void maxOccurrencesReached_endsSeries() {
    applyThroughLedger();
    var event =
        completed(
            "2026-03-02T08:00:00Z", "2026-03-02T09:00:00Z", 3, TestEvents.daily(RULE_ID, 3, null));

    materializer.handle(event);

    verify(taskService, never()).createRecurringInstance(any(), any());
  }

  @Test
  void nextDatePastEndDate_endsSeries() {
    applyThroughLedger();
    var rule = TestEvents.daily(RULE_ID, null, LocalDate.of(2026, 3, 2));
    var event = completed("2026-03-02T08:00:00Z", "2026-03-02T09:00:00Z", 4, rule);

    materializer.handle(event);

    verify(taskService, never()).createRecurringInstance(any(), any());
  }

  @Test
  void existingChild_isNotDuplicated() {
    applyThroughLedger();
    var event =
        completed(
            "2026-03-02T08:00:00Z", "2026-03-02T09:00:00Z", 1, TestEvents.daily(RULE_ID, 3, null));
    when(taskService.hasRecurringChild(event.taskId())).thenReturn(true);

    materializer.handle(event);

    verify(taskService, never()).createRecurringInstance(any(), any());
  }

  @Test
  void invalidRule_isReportedWithoutFailing() {
    applyThroughLedger();
    var noEnd =
        new RecurrenceSnapshot(
            RULE_ID, RecurrenceFrequency.DAILY, 1, Set.of(), null, null, null, null);
    var event = completed("2026-03-02T08:00:00Z", "2026-03-02T09:00:00Z", 1, noEnd);

    materializer.handle(event);

    verifyNoInteractions(taskService);
  }

  @Test
  void alreadyProcessed_createsNothing() {
    when(ledger.processOnce(any(), anyString(), anyString(), any()))
        .thenReturn(ProcessingOutcome.SKIPPED_ALREADY_PROCESSED);

    materializer.handle(
        completed(
            "2026-03-02T08:00:00Z", "2026-03-02T09:00:00Z", 1, TestEvents.daily(RULE_ID, 3, null)));

    verifyNoInteractions(taskService);
  }

  @Test
  void nonRecurringCompletionAndDeletion_areIgnored() {
    var oneOff =
        TaskCompletedEvent.of(TestEvents.task("user-1", "Once"), null, "c", TestEvents.NOW);
    var deleted =
        TaskDeletedEvent.of(UUID.randomUUID(), "user-1", RULE_ID, "c", TestEvents.NOW);

    materializer.handle(oneOff);
    materializer.handle(deleted);

    verifyNoInteractions(ledger, taskService);
  }

  @Test
  void ledgerKeyIsRecurrenceServiceConsumerId() {
    applyThroughLedger();
    var event =
        completed(
            "2026-03-02T08:00:00Z", "2026-03-02T09:00:00Z", 1, TestEvents.daily(RULE_ID, 3, null));

    materializer.handle(event);

    verify(ledger)
        .processOnce(eq(event.eventId()), eq("recurrence-service"), eq("task.completed"), any());
  }

  private void applyThroughLedger() {
    when(ledger.processOnce(any(), anyString(), anyString(), any()))
        .thenAnswer(
            invocation -> {
              Runnable handler = invocation.getArgument(3);
              handler.run();
              return ProcessingOutcome.APPLIED;
            });
  }

  private static TaskCompletedEvent completed(
      String due, String completedAt, int occurrence, RecurrenceSnapshot rule) {
    var task =
        TestEvents.completedInstance(
            UUID.randomUUID(),
            "user-1",
            RULE_ID,
            Instant.parse(due),
            Instant.parse(completedAt),
            occurrence);
    return TaskCompletedEvent.of(task, rule, "corr-1", Instant.parse(completedAt));
  }
}

package io.todoflow.taskevents.recurrence;

import io.todoflow.taskevents.config.BrokerProperties;
import io.todoflow.taskevents.config.ConsumerProperties;
import io.todoflow.taskevents.consumer.EventConsumer;
import io.todoflow.taskevents.event.RecurrenceSnapshot;
import io.todoflow.taskevents.event.TaskChangeEvent;
import io.todoflow.taskevents.event.TaskCompletedEvent;
import io.todoflow.taskevents.event.TaskSnapshot;
import io.todoflow.taskevents.idempotency.IdempotencyLedger;
import io.todoflow.taskevents.task.TaskService;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Creates the next instance of a recurring series when an instance is completed. Only completion
 * events carrying a recurrence rule trigger work; deletion never does.
 *
 * <p>The next date is computed from the later of the completed instance's due date and its
 * completion date, so finishing early never schedules the follow-up before the instance it
 * replaces. The child keeps the parent's due time of day (UTC).
 */
@Component
public class RecurrenceMaterializer implements EventConsumer {

  private static final Logger log = LoggerFactory.getLogger(RecurrenceMaterializer.class);

  public static final String CONSUMER_ID = "recurrence-service";

  private final IdempotencyLedger ledger;
  private final TaskService taskService;
  private final BrokerProperties brokerProperties;
  private final ConsumerProperties consumerProperties;

  public RecurrenceMaterializer(
      IdempotencyLedger ledger,
      TaskService taskService,
      BrokerProperties brokerProperties,
      ConsumerProperties consumerProperties) {
    this.ledger = ledger;
    this.taskService = taskService;
    this.brokerProperties = brokerProperties;
    this.consumerProperties = consumerProperties;
  }

  @Override
  public String consumerId() {
    return CONSUMER_ID;
  }

  @Override
  public String consumerGroup() {
    return CONSUMER_ID;
  }

  @Override
  public String topic() {
    return brokerProperties.taskEventsTopic();
  }

  @Override
  public boolean isEnabled() {
    return consumerProperties.recurrenceEnabled();
  }

  @Override
  public void handle(TaskChangeEvent event) {
    if (!(event instanceof TaskCompletedEvent completed) || completed.recurrence() == null) {
      return;
    }
    ledger.processOnce(
        completed.eventId(),
        CONSUMER_ID,
        completed.eventType().cloudEventType(),
        () -> materializeNext(completed));
  }

  private void materializeNext(TaskCompletedEvent event) {
    TaskSnapshot task = event.task();
    RecurrenceSnapshot rule = event.recurrence();
    try {
      RecurrenceCalculator.validate(rule);
    } catch (IllegalArgumentException e) {
      log.error(
          "Invalid recurrence rule {} on completed task {}, no next instance: {}",
          rule.ruleId(),
          task.taskId(),
          e.getMessage());
      return;
    }

    if (!RecurrenceCalculator.allowsAnotherAfter(rule, task.occurrenceNumber())) {
      log.info(
          "Recurrence {} reached max occurrences {} at task {}",
          rule.ruleId(),
          rule.maxOccurrences(),
          task.taskId());
      return;
    }

    Instant completedAt = task.completedAt() != null ? task.completedAt() : event.occurredAt();
    LocalDate anchor = latestOf(toUtcDate(completedAt), task.dueDate());
    Optional<LocalDate> next = RecurrenceCalculator.nextOccurrence(rule, anchor);
    if (next.isEmpty()) {
      log.info(
          "Recurrence {} ended: next occurrence after {} is past end date {}",
          rule.ruleId(),
          anchor,
          rule.endDate());
      return;
    }

    if (taskService.hasRecurringChild(task.taskId())) {
      log.info("Task {} already has its next instance, skipping", task.taskId());
      return;
    }

    LocalTime timeOfDay =
        (task.dueDate() != null ? task.dueDate() : completedAt)
            .atZone(ZoneOffset.UTC)
            .toLocalTime();
    Instant dueDate = next.get().atTime(timeOfDay).toInstant(ZoneOffset.UTC);
    taskService.createRecurringInstance(task.taskId(), dueDate);
  }

  private static LocalDate latestOf(LocalDate completionDate, Instant dueDate) {
    if (dueDate == null) {
      return completionDate;
    }
    LocalDate dueDay = toUtcDate(dueDate);
    return dueDay.isAfter(completionDate) ? dueDay : completionDate;
  }

  private static LocalDate toUtcDate(Instant instant) {
    return instant.atZone(ZoneOffset.UTC).toLocalDate();
  }
}

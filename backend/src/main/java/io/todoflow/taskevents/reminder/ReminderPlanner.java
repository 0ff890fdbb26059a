package io.todoflow.taskevents.reminder;

import io.todoflow.taskevents.config.BrokerProperties;
import io.todoflow.taskevents.config.ConsumerProperties;
import io.todoflow.taskevents.consumer.EventConsumer;
import io.todoflow.taskevents.event.TaskChangeEvent;
import io.todoflow.taskevents.event.TaskCompletedEvent;
import io.todoflow.taskevents.event.TaskCreatedEvent;
import io.todoflow.taskevents.event.TaskDeletedEvent;
import io.todoflow.taskevents.event.TaskSnapshot;
import io.todoflow.taskevents.event.TaskUpdatedEvent;
import io.todoflow.taskevents.idempotency.IdempotencyLedger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps one pending reminder per task at {@code dueDate - offset}. Creation and due-date changes
 * (re)schedule it; completion, deletion or removal of the due date cancel it.
 */
@Component
public class ReminderPlanner implements EventConsumer {

  private static final Logger log = LoggerFactory.getLogger(ReminderPlanner.class);

  public static final String CONSUMER_ID = "reminder-service";

  private static final List<ReminderStatus> OPEN_STATUSES =
      List.of(ReminderStatus.PENDING, ReminderStatus.FAILED);

  private final IdempotencyLedger ledger;
  private final ReminderScheduleRepository reminderRepository;
  private final NotificationPreferenceRepository preferenceRepository;
  private final ReminderProperties reminderProperties;
  private final BrokerProperties brokerProperties;
  private final ConsumerProperties consumerProperties;
  private final Clock clock;

  public ReminderPlanner(
      IdempotencyLedger ledger,
      ReminderScheduleRepository reminderRepository,
      NotificationPreferenceRepository preferenceRepository,
      ReminderProperties reminderProperties,
      BrokerProperties brokerProperties,
      ConsumerProperties consumerProperties,
      Clock clock) {
    this.ledger = ledger;
    this.reminderRepository = reminderRepository;
    this.preferenceRepository = preferenceRepository;
    this.reminderProperties = reminderProperties;
    this.brokerProperties = brokerProperties;
    this.consumerProperties = consumerProperties;
    this.clock = clock;
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
    return consumerProperties.reminderEnabled();
  }

  @Override
  public void handle(TaskChangeEvent event) {
    ledger.processOnce(
        event.eventId(), CONSUMER_ID, event.eventType().cloudEventType(), () -> apply(event));
  }

  private void apply(TaskChangeEvent event) {
    if (event instanceof TaskCreatedEvent created) {
      plan(created.task(), List.of());
    } else if (event instanceof TaskUpdatedEvent updated) {
      plan(updated.task(), openReminders(updated.taskId()));
    } else if (event instanceof TaskCompletedEvent completed) {
      cancel(openReminders(completed.taskId()), "task completed");
    } else if (event instanceof TaskDeletedEvent deleted) {
      cancel(openReminders(deleted.taskId()), "task deleted");
    }
  }

  private void plan(TaskSnapshot task, List<ReminderSchedule> existing) {
    if (task.completed() || task.dueDate() == null) {
      cancel(existing, task.completed() ? "task completed" : "due date removed");
      return;
    }

    Instant now = clock.instant();
    var preference =
        preferenceRepository
            .findByUserId(task.userId())
            .orElseGet(() -> NotificationPreference.defaultsFor(task.userId()));
    Instant scheduledTime = task.dueDate().minus(offsetFor(task, preference));

    if (existing.size() == 1
        && existing.get(0).getStatus() == ReminderStatus.PENDING
        && existing.get(0).getScheduledTime().equals(scheduledTime)
        && existing.get(0).getTaskTitle().equals(task.title())) {
      log.debug("Reminder for task {} unchanged at {}", task.taskId(), scheduledTime);
      return;
    }
    cancel(existing, "rescheduled");

    if (!scheduledTime.isAfter(now)) {
      log.info(
          "Reminder time {} for task {} already passed, not scheduling",
          scheduledTime,
          task.taskId());
      return;
    }

    var reminder =
        reminderRepository.save(
            new ReminderSchedule(
                task.taskId(),
                task.userId(),
                task.title(),
                task.dueDate(),
                scheduledTime,
                preference.enabledChannels(),
                now));
    log.info(
        "Scheduled reminder {} for task {} at {} (due {})",
        reminder.getId(),
        task.taskId(),
        scheduledTime,
        task.dueDate());
  }

  private Duration offsetFor(TaskSnapshot task, NotificationPreference preference) {
    Integer minutes = task.reminderOffsetMinutes();
    if (minutes == null) {
      minutes = preference.getDefaultReminderOffsetMinutes();
    }
    if (minutes == null) {
      return reminderProperties.defaultOffset();
    }
    return Duration.ofMinutes(Math.max(0, minutes));
  }

  private List<ReminderSchedule> openReminders(UUID taskId) {
    int maxAttempts = reminderProperties.maxAttempts();
    return reminderRepository.findByTaskIdAndStatusInForUpdate(taskId, OPEN_STATUSES).stream()
        .filter(r -> !r.isTerminal(maxAttempts))
        .toList();
  }

  private void cancel(List<ReminderSchedule> reminders, String reason) {
    if (reminders.isEmpty()) {
      return;
    }
    Instant now = clock.instant();
    for (ReminderSchedule reminder : reminders) {
      reminder.cancel(reason, now);
      log.info(
          "Cancelled reminder {} for task {}: {}", reminder.getId(), reminder.getTaskId(), reason);
    }
    reminderRepository.saveAll(reminders);
  }
}

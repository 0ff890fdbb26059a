package io.todoflow.taskevents.reminder;

import io.todoflow.taskevents.config.ConsumerProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Delivers due reminders. Each run scans a bounded page of due reminders, groups them per user and
 * coalesces reminders within the batch window into a single delivery, pulling in that user's
 * pending reminders scheduled inside the window even if they are not due yet.
 *
 * <p>Each batch is handled in its own transaction with the reminder rows locked, so a concurrent
 * cancellation either wins before delivery or waits until the batch is recorded as sent. Errors
 * for one user do not affect others.
 */
@Component
public class ReminderSweeper {

  private static final Logger log = LoggerFactory.getLogger(ReminderSweeper.class);

  private final ReminderScheduleRepository reminderRepository;
  private final NotificationPreferenceRepository preferenceRepository;
  private final ReminderDispatcher dispatcher;
  private final ReminderProperties properties;
  private final ConsumerProperties consumerProperties;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public ReminderSweeper(
      ReminderScheduleRepository reminderRepository,
      NotificationPreferenceRepository preferenceRepository,
      ReminderDispatcher dispatcher,
      ReminderProperties properties,
      ConsumerProperties consumerProperties,
      TransactionTemplate transactionTemplate,
      Clock clock) {
    this.reminderRepository = reminderRepository;
    this.preferenceRepository = preferenceRepository;
    this.dispatcher = dispatcher;
    this.properties = properties;
    this.consumerProperties = consumerProperties;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  @Scheduled(fixedDelayString = "${taskflow.reminder.sweep-interval-ms:30000}")
  public void scheduledSweep() {
    if (consumerProperties.reminderEnabled()) {
      sweep();
    }
  }

  /** Runs one sweep and returns the number of reminders delivered. */
  public int sweep() {
    Instant now = clock.instant();
    int maxAttempts = properties.maxAttempts();
    var due =
        transactionTemplate.execute(
            tx ->
                reminderRepository.findDue(
                    now, maxAttempts, PageRequest.of(0, properties.scanLimit())));
    if (due == null || due.isEmpty()) {
      return 0;
    }

    Map<String, List<ReminderSchedule>> byUser = new LinkedHashMap<>();
    for (ReminderSchedule reminder : due) {
      byUser.computeIfAbsent(reminder.getUserId(), u -> new ArrayList<>()).add(reminder);
    }

    int delivered = 0;
    for (var entry : byUser.entrySet()) {
      try {
        for (List<UUID> batch : batchesFor(entry.getKey(), entry.getValue(), now)) {
          delivered += deliverBatch(entry.getKey(), batch, now);
        }
      } catch (Exception e) {
        log.error("Failed to process reminders for user {}", entry.getKey(), e);
      }
    }

    log.info(
        "Reminder sweep completed: {} due, {} delivered across {} users",
        due.size(),
        delivered,
        byUser.size());
    return delivered;
  }

  /**
   * Groups one user's due reminders with the pending reminders that fall inside their batch
   * window but are not due yet. Groups without a due reminder wait for a later sweep.
   */
  private List<List<UUID>> batchesFor(String userId, List<ReminderSchedule> due, Instant now) {
    Instant windowEnd =
        due.get(due.size() - 1).getScheduledTime().plus(properties.batchWindow());
    var upcoming =
        transactionTemplate.execute(
            tx -> reminderRepository.findUpcomingForUser(userId, now, windowEnd));
    Set<UUID> dueIds = new HashSet<>();
    due.forEach(reminder -> dueIds.add(reminder.getId()));

    List<ReminderSchedule> candidates = new ArrayList<>(due);
    if (upcoming != null) {
      upcoming.stream().filter(r -> !dueIds.contains(r.getId())).forEach(candidates::add);
    }
    candidates.sort(Comparator.comparing(ReminderSchedule::getScheduledTime));

    List<List<UUID>> batches = new ArrayList<>();
    for (List<UUID> batch : coalesce(candidates)) {
      if (batch.stream().anyMatch(dueIds::contains)) {
        batches.add(batch);
      }
    }
    return batches;
  }

  /** Splits one user's reminders, ordered by scheduled time, into batch-window groups. */
  List<List<UUID>> coalesce(List<ReminderSchedule> reminders) {
    List<List<UUID>> batches = new ArrayList<>();
    List<UUID> current = null;
    Instant windowEnd = null;
    for (ReminderSchedule reminder : reminders) {
      if (current == null || reminder.getScheduledTime().isAfter(windowEnd)) {
        current = new ArrayList<>();
        batches.add(current);
        windowEnd = reminder.getScheduledTime().plus(properties.batchWindow());
      }
      current.add(reminder.getId());
    }
    return batches;
  }

  private int deliverBatch(String userId, List<UUID> reminderIds, Instant now) {
    Integer delivered =
        transactionTemplate.execute(
            tx -> {
              int maxAttempts = properties.maxAttempts();
              var reminders =
                  reminderRepository.findAllByIdForUpdate(reminderIds).stream()
                      .filter(
                          r -> r.isDue(now, maxAttempts) || r.getStatus() == ReminderStatus.PENDING)
                      .toList();
              if (reminders.isEmpty()) {
                return 0;
              }

              var preference =
                  preferenceRepository
                      .findByUserId(userId)
                      .orElseGet(() -> NotificationPreference.defaultsFor(userId));

              var quietEnd = preference.quietPeriodEnd(now);
              if (quietEnd.isPresent()) {
                reminders.forEach(r -> r.deferUntil(quietEnd.get(), now));
                log.info(
                    "Deferred {} reminders for user {} until quiet hours end at {}",
                    reminders.size(),
                    userId,
                    quietEnd.get());
                return 0;
              }

              var channels = preference.enabledChannels();
              if (channels.isEmpty()) {
                reminders.forEach(r -> r.cancel("no enabled notification channel", now));
                log.info(
                    "Cancelled {} reminders for user {}: no enabled notification channel",
                    reminders.size(),
                    userId);
                return 0;
              }

              var delivery =
                  new ReminderDelivery(
                      userId,
                      reminders.stream()
                          .map(
                              r ->
                                  new ReminderDelivery.Item(
                                      r.getId(), r.getTaskId(), r.getTaskTitle(), r.getDueTime()))
                          .toList());
              try {
                var usedChannels = dispatcher.dispatch(delivery, channels);
                reminders.forEach(r -> r.markSent(now));
                log.info(
                    "Sent {} reminder(s) to user {} via {}",
                    reminders.size(),
                    userId,
                    usedChannels);
                return reminders.size();
              } catch (ReminderDeliveryException e) {
                Instant retryAt = now.plus(properties.retryBackoff());
                for (ReminderSchedule reminder : reminders) {
                  reminder.markFailed(e.getMessage(), now, retryAt, maxAttempts);
                  if (reminder.isTerminal(maxAttempts)) {
                    log.error(
                        "Giving up on reminder {} for task {} after {} attempts: {}",
                        reminder.getId(),
                        reminder.getTaskId(),
                        reminder.getAttempts(),
                        e.getMessage());
                  }
                }
                log.warn(
                    "Reminder delivery failed for user {}, retry at {}: {}",
                    userId,
                    retryAt,
                    e.getMessage());
                return 0;
              }
            });
    return delivered != null ? delivered : 0;
  }
}

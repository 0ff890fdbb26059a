package io.todoflow.taskevents.task;

import io.todoflow.taskevents.event.RecurrenceSnapshot;
import io.todoflow.taskevents.event.TaskCompletedEvent;
import io.todoflow.taskevents.event.TaskCreatedEvent;
import io.todoflow.taskevents.event.TaskDeletedEvent;
import io.todoflow.taskevents.event.TaskUpdatedEvent;
import io.todoflow.taskevents.exception.InvalidStateException;
import io.todoflow.taskevents.exception.ResourceNotFoundException;
import io.todoflow.taskevents.logging.CorrelationIds;
import io.todoflow.taskevents.recurrence.RecurrenceRule;
import io.todoflow.taskevents.recurrence.RecurrenceRuleRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * System of record for tasks. Every mutation publishes a task change event as a Spring
 * application event inside its transaction; the event publisher forwards it to the broker after
 * commit.
 */
@Service
public class TaskService {

  private static final Logger log = LoggerFactory.getLogger(TaskService.class);

  private final TaskRepository taskRepository;
  private final RecurrenceRuleRepository recurrenceRuleRepository;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public TaskService(
      TaskRepository taskRepository,
      RecurrenceRuleRepository recurrenceRuleRepository,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.taskRepository = taskRepository;
    this.recurrenceRuleRepository = recurrenceRuleRepository;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public Task getTask(UUID taskId) {
    return taskRepository
        .findActiveById(taskId)
        .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
  }

  @Transactional
  public Task createTask(TaskDraft draft) {
    if (draft.title() == null || draft.title().isBlank()) {
      throw new InvalidStateException("Invalid task", "Title is required");
    }
    Instant now = clock.instant();
    var task =
        new Task(
            draft.userId(),
            draft.title(),
            draft.description(),
            draft.priority(),
            draft.dueDate(),
            draft.reminderOffsetMinutes(),
            draft.sharedWith(),
            now);

    if (draft.recurrence() != null) {
      var rule = recurrenceRuleRepository.save(newRule(draft.userId(), draft.recurrence(), now));
      task.linkToSeries(rule.getId(), null, 1);
    }

    task = taskRepository.save(task);
    eventPublisher.publishEvent(
        TaskCreatedEvent.of(task.toSnapshot(), CorrelationIds.currentOrGenerate(), now));
    log.info("Created task {} for user {}", task.getId(), task.getUserId());
    return task;
  }

  @Transactional
  public Task updateTask(UUID taskId, TaskUpdate update) {
    var task = getTask(taskId);
    Instant now = clock.instant();
    var changed =
        task.update(
            update.title(),
            update.description(),
            update.priority(),
            update.dueDate(),
            update.reminderOffsetMinutes(),
            update.sharedWith(),
            now);
    if (changed.isEmpty()) {
      log.debug("Update of task {} changed nothing", taskId);
      return task;
    }
    task = taskRepository.save(task);
    eventPublisher.publishEvent(
        TaskUpdatedEvent.of(task.toSnapshot(), changed, CorrelationIds.currentOrGenerate(), now));
    log.info("Updated task {} fields={}", taskId, changed);
    return task;
  }

  @Transactional
  public Task completeTask(UUID taskId) {
    var task = getTask(taskId);
    Instant now = clock.instant();
    task.complete(now);
    task = taskRepository.save(task);

    RecurrenceSnapshot recurrence =
        task.getRecurrenceRuleId() != null
            ? recurrenceRuleRepository
                .findById(task.getRecurrenceRuleId())
                .map(RecurrenceRule::toSnapshot)
                .orElse(null)
            : null;
    eventPublisher.publishEvent(
        TaskCompletedEvent.of(
            task.toSnapshot(), recurrence, CorrelationIds.currentOrGenerate(), now));
    log.info("Completed task {} recurring={}", taskId, recurrence != null);
    return task;
  }

  @Transactional
  public void deleteTask(UUID taskId) {
    var task = getTask(taskId);
    Instant now = clock.instant();
    task.markDeleted(now);
    taskRepository.save(task);
    eventPublisher.publishEvent(
        TaskDeletedEvent.of(
            task.getId(),
            task.getUserId(),
            task.getRecurrenceRuleId(),
            CorrelationIds.currentOrGenerate(),
            now));
    log.info("Deleted task {}", taskId);
  }

  @Transactional(readOnly = true)
  public boolean hasRecurringChild(UUID parentTaskId) {
    return taskRepository.existsByParentTaskId(parentTaskId);
  }

  /**
   * Creates the next instance of a recurring series from its completed parent. Returns empty when
   * the parent no longer exists or was deleted, since deletion ends the series.
   */
  @Transactional
  public Optional<Task> createRecurringInstance(UUID parentTaskId, Instant dueDate) {
    var parent = taskRepository.findById(parentTaskId).orElse(null);
    if (parent == null || parent.isDeleted()) {
      log.info("Parent task {} is gone, not creating next instance", parentTaskId);
      return Optional.empty();
    }
    Instant now = clock.instant();
    var child =
        new Task(
            parent.getUserId(),
            parent.getTitle(),
            parent.getDescription(),
            parent.getPriority(),
            dueDate,
            parent.getReminderOffsetMinutes(),
            parent.getSharedWith(),
            now);
    child.linkToSeries(
        parent.getRecurrenceRuleId(), parent.getId(), parent.getOccurrenceNumber() + 1);
    child = taskRepository.save(child);
    eventPublisher.publishEvent(
        TaskCreatedEvent.of(child.toSnapshot(), CorrelationIds.currentOrGenerate(), now));
    log.info(
        "Created recurring instance {} (occurrence {}) from parent {}",
        child.getId(),
        child.getOccurrenceNumber(),
        parentTaskId);
    return Optional.of(child);
  }

  private static RecurrenceRule newRule(
      String userId, TaskDraft.RecurrenceRequest request, Instant now) {
    try {
      return new RecurrenceRule(
          userId,
          request.frequency(),
          request.interval(),
          request.byWeekday(),
          request.byMonthday(),
          request.rrule(),
          request.endDate(),
          request.maxOccurrences(),
          now);
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException("Invalid recurrence rule", e.getMessage(), e);
    }
  }
}

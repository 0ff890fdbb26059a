package io.todoflow.taskevents.reminder;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ReminderScheduleRepository extends JpaRepository<ReminderSchedule, UUID> {

  /** Reminders the sweeper may pick up now, ordered per user by scheduled time. */
  @Query(
      """
      SELECT r FROM ReminderSchedule r
      WHERE (r.status = io.todoflow.taskevents.reminder.ReminderStatus.PENDING
             OR (r.status = io.todoflow.taskevents.reminder.ReminderStatus.FAILED
                 AND r.attempts < :maxAttempts))
        AND r.nextAttemptAt <= :now
      ORDER BY r.userId, r.scheduledTime
      """)
  List<ReminderSchedule> findDue(
      @Param("now") Instant now, @Param("maxAttempts") int maxAttempts, Pageable pageable);

  /** A user's pending reminders not yet due but scheduled up to {@code until}. */
  @Query(
      """
      SELECT r FROM ReminderSchedule r
      WHERE r.userId = :userId
        AND r.status = io.todoflow.taskevents.reminder.ReminderStatus.PENDING
        AND r.nextAttemptAt > :now
        AND r.scheduledTime <= :until
      ORDER BY r.scheduledTime
      """)
  List<ReminderSchedule> findUpcomingForUser(
      @Param("userId") String userId, @Param("now") Instant now, @Param("until") Instant until);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT r FROM ReminderSchedule r WHERE r.id IN :ids ORDER BY r.scheduledTime")
  List<ReminderSchedule> findAllByIdForUpdate(@Param("ids") Collection<UUID> ids);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query(
      """
      SELECT r FROM ReminderSchedule r
      WHERE r.taskId = :taskId AND r.status IN :statuses
      ORDER BY r.scheduledTime
      """)
  List<ReminderSchedule> findByTaskIdAndStatusInForUpdate(
      @Param("taskId") UUID taskId, @Param("statuses") Collection<ReminderStatus> statuses);
}

package io.todoflow.taskevents.idempotency;

import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProcessedEventRepository
    extends JpaRepository<ProcessedEvent, ProcessedEventId> {

  @Modifying
  @Query("DELETE FROM ProcessedEvent p WHERE p.processedAt < :cutoff")
  int deleteProcessedBefore(@Param("cutoff") Instant cutoff);
}

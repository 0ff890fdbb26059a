package io.todoflow.taskevents.idempotency;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import java.time.Instant;
import org.springframework.data.domain.Persistable;

/**
 * Ledger row: {@code (eventId, consumerId)} was applied. Always persisted as new, so a concurrent
 * duplicate fails on the primary key instead of being merged.
 */
@Entity
@Table(name = "processed_events")
public class ProcessedEvent implements Persistable<ProcessedEventId> {

  @EmbeddedId private ProcessedEventId id;

  @Column(name = "event_type", length = 50)
  private String eventType;

  @Column(name = "processed_at", nullable = false)
  private Instant processedAt;

  @Transient private boolean isNew = true;

  protected ProcessedEvent() {}

  public ProcessedEvent(ProcessedEventId id, String eventType, Instant processedAt) {
    this.id = id;
    this.eventType = eventType;
    this.processedAt = processedAt;
  }

  @Override
  public ProcessedEventId getId() {
    return id;
  }

  public String getEventType() {
    return eventType;
  }

  public Instant getProcessedAt() {
    return processedAt;
  }

  @Override
  public boolean isNew() {
    return isNew;
  }

  @PostLoad
  @PostPersist
  void markNotNew() {
    this.isNew = false;
  }
}

package io.todoflow.taskevents.idempotency;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

@Embeddable
public class ProcessedEventId implements Serializable {

  @Column(name = "event_id", nullable = false)
  private UUID eventId;

  @Column(name = "consumer_id", nullable = false, length = 200)
  private String consumerId;

  protected ProcessedEventId() {}

  public ProcessedEventId(UUID eventId, String consumerId) {
    this.eventId = eventId;
    this.consumerId = consumerId;
  }

  public UUID getEventId() {
    return eventId;
  }

  public String getConsumerId() {
    return consumerId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ProcessedEventId other)) {
      return false;
    }
    return Objects.equals(eventId, other.eventId) && Objects.equals(consumerId, other.consumerId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(eventId, consumerId);
  }

  @Override
  public String toString() {
    return eventId + "@" + consumerId;
  }
}

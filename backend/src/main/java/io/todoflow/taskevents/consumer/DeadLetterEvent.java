package io.todoflow.taskevents.consumer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** A record a consumer could not process and gave up on. Kept for inspection and replay. */
@Entity
@Table(name = "dead_letter_events")
public class DeadLetterEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "consumer_id", nullable = false, length = 200)
  private String consumerId;

  @Column(name = "topic", nullable = false, length = 200)
  private String topic;

  @Column(name = "partition_number", nullable = false)
  private int partition;

  @Column(name = "record_offset", nullable = false)
  private long offset;

  @Column(name = "record_key", length = 200)
  private String key;

  @Column(name = "reason", nullable = false, columnDefinition = "TEXT")
  private String reason;

  @Column(name = "payload", columnDefinition = "TEXT")
  private String payload;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected DeadLetterEvent() {}

  public DeadLetterEvent(
      String consumerId,
      String topic,
      int partition,
      long offset,
      String key,
      String reason,
      String payload,
      Instant createdAt) {
    this.consumerId = consumerId;
    this.topic = topic;
    this.partition = partition;
    this.offset = offset;
    this.key = key;
    this.reason = reason;
    this.payload = payload;
    this.createdAt = createdAt;
  }

  public UUID getId() {
    return id;
  }

  public String getConsumerId() {
    return consumerId;
  }

  public String getTopic() {
    return topic;
  }

  public int getPartition() {
    return partition;
  }

  public long getOffset() {
    return offset;
  }

  public String getKey() {
    return key;
  }

  public String getReason() {
    return reason;
  }

  public String getPayload() {
    return payload;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}

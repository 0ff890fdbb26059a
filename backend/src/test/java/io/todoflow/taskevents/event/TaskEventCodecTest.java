package io.todoflow.taskevents.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.todoflow.taskevents.recurrence.RecurrenceFrequency;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class TaskEventCodecTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final TaskEventCodec codec = new TaskEventCodec(objectMapper);

  @Test
  void encode_writesCloudEventsEnvelope() throws Exception {
    var task = TestEvents.task(UUID.randomUUID(), "user-1", "Buy milk", null, List.of("user-2"));
    var event = TaskCreatedEvent.of(task, "corr-1", TestEvents.NOW);

    var json = objectMapper.readTree(codec.encode(event));

    assertThat(json.get("specversion").asText()).isEqualTo("1.0");
    assertThat(json.get("id").asText()).isEqualTo(event.eventId().toString());
    assertThat(json.get("source").asText()).isEqualTo(TaskEventCodec.SOURCE);
    assertThat(json.get("type").asText()).isEqualTo("task.created");
    assertThat(json.get("subject").asText()).isEqualTo("tasks/" + task.taskId());
    assertThat(json.get("time").asText()).isEqualTo("2026-03-02T09:00:00Z");
    assertThat(json.get("datacontenttype").asText()).isEqualTo("application/json");
    assertThat(json.get("correlationid").asText()).isEqualTo("corr-1");
    assertThat(json.get("partitionkey").asText()).isEqualTo("user-1");
    assertThat(json.at("/data/task/title").asText()).isEqualTo("Buy milk");
    assertThat(json.at("/data/task/sharedWith/0").asText()).isEqualTo("user-2");
    assertThat(json.at("/data/task/dueDate").isNull()).isTrue();
  }

  @Test
  void completedEventWithRecurrence_survivesEncodeDecode() {
    var ruleId = UUID.randomUUID();
    var task =
        TestEvents.completedInstance(
            UUID.randomUUID(),
            "user-1",
            ruleId,
            Instant.parse("2026-03-02T08:00:00Z"),
            Instant.parse("2026-03-02T10:15:00Z"),
            2);
    var recurrence =
        new RecurrenceSnapshot(
            ruleId,
            RecurrenceFrequency.WEEKLY,
            2,
            Set.of(DayOfWeek.FRIDAY, DayOfWeek.MONDAY),
            null,
            LocalDate.of(2026, 6, 30),
            null,
            null);
    var event = TaskCompletedEvent.of(task, recurrence, "corr-2", TestEvents.NOW);

    var decoded = codec.decode(codec.encode(event));

    assertThat(decoded).isEqualTo(event);
  }

  @Test
  void deletedEvent_carriesOnlyIdentifiers() throws Exception {
    var ruleId = UUID.randomUUID();
    var event =
        TaskDeletedEvent.of(UUID.randomUUID(), "user-9", ruleId, "corr-3", TestEvents.NOW);

    var payload = codec.encode(event);
    var data = objectMapper.readTree(payload).get("data");

    assertThat(data.has("task")).isFalse();
    assertThat(data.get("recurrenceRuleId").asText()).isEqualTo(ruleId.toString());
    assertThat(codec.decode(payload)).isEqualTo(event);
  }

  @Test
  void updatedEvent_keepsChangedFields() {
    var event =
        TaskUpdatedEvent.of(
            TestEvents.task("user-1", "Renamed"), List.of("title", "dueDate"), "c", TestEvents.NOW);

    var decoded = (TaskUpdatedEvent) codec.decode(codec.encode(event));

    assertThat(decoded.changedFields()).containsExactly("title", "dueDate");
  }

  @Test
  void decode_unknownType_throws() {
    var root = envelope();
    root.put("type", "task.archived");

    assertThatThrownBy(() -> codec.decode(root.toString()))
        .isInstanceOf(MalformedEventException.class)
        .hasMessageContaining("task.archived");
  }

  @Test
  void decode_missingCorrelationId_throws() {
    var root = envelope();
    root.remove("correlationid");

    assertThatThrownBy(() -> codec.decode(root.toString()))
        .isInstanceOf(MalformedEventException.class)
        .hasMessageContaining("correlationid");
  }

  @Test
  void decode_wrongSpecVersion_throws() {
    var root = envelope();
    root.put("specversion", "0.3");

    assertThatThrownBy(() -> codec.decode(root.toString()))
        .isInstanceOf(MalformedEventException.class)
        .hasMessageContaining("specversion");
  }

  @Test
  void decode_createdWithoutTask_throws() {
    var root = envelope();
    root.putObject("data");

    assertThatThrownBy(() -> codec.decode(root.toString()))
        .isInstanceOf(MalformedEventException.class)
        .hasMessageContaining("task");
  }

  @Test
  void decode_partitionKeyMismatch_throws() {
    var root = envelope();
    root.put("partitionkey", "someone-else");

    assertThatThrownBy(() -> codec.decode(root.toString()))
        .isInstanceOf(MalformedEventException.class)
        .hasMessageContaining("partitionkey");
  }

  @Test
  void decode_notJson_throws() {
    assertThatThrownBy(() -> codec.decode("{not json"))
        .isInstanceOf(MalformedEventException.class);
    assertThatThrownBy(() -> codec.decode(" ")).isInstanceOf(MalformedEventException.class);
  }

  @Test
  void decode_ignoresUnknownAttributes() {
    var root = envelope();
    root.put("traceparent", "00-abc-def-01");

    assertThat(codec.decode(root.toString())).isInstanceOf(TaskCreatedEvent.class);
  }

  private ObjectNode envelope() {
    var event = TestEvents.created(TestEvents.task("user-1", "Write report"));
    try {
      return (ObjectNode) objectMapper.readTree(codec.encode(event));
    } catch (Exception e) {
      throw new IllegalStateException(e);
    }
  }
}

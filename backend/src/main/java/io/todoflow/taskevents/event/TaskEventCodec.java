package io.todoflow.taskevents.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.todoflow.taskevents.recurrence.RecurrenceFrequency;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Encodes task change events as CloudEvents 1.0 structured JSON and decodes them back.
 *
 * <p>Decoding is strict: a missing or mistyped required attribute, an unknown {@code type}, or a
 * {@code data} block that does not match the event type raises {@link MalformedEventException}.
 * Unknown extra attributes are ignored.
 */
@Component
public class TaskEventCodec {

  public static final String SPEC_VERSION = "1.0";
  public static final String SOURCE = "/taskflow/task-service";
  public static final String CONTENT_TYPE = "application/json";

  private final ObjectMapper objectMapper;

  public TaskEventCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encode(TaskChangeEvent event) {
    ObjectNode root = objectMapper.createObjectNode();
    root.put("specversion", SPEC_VERSION);
    root.put("id", event.eventId().toString());
    root.put("source", SOURCE);
    root.put("type", event.eventType().cloudEventType());
    root.put("subject", "tasks/" + event.taskId());
    root.put("time", event.occurredAt().toString());
    root.put("datacontenttype", CONTENT_TYPE);
    root.put("correlationid", event.correlationId());
    root.put("partitionkey", event.partitionKey());
    root.set("data", encodeData(event));
    try {
      return objectMapper.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode event " + event.eventId(), e);
    }
  }

  public TaskChangeEvent decode(String payload) {
    if (payload == null || payload.isBlank()) {
      throw new MalformedEventException("Empty event payload");
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (JsonProcessingException e) {
      throw new MalformedEventException("Event payload is not valid JSON", e);
    }
    if (root == null || !root.isObject()) {
      throw new MalformedEventException("Event payload is not a JSON object");
    }

    String specVersion = requireText(root, "specversion");
    if (!SPEC_VERSION.equals(specVersion)) {
      throw new MalformedEventException("Unsupported specversion: " + specVersion);
    }
    UUID eventId = requireUuid(root, "id");
    requireText(root, "source");
    String typeValue = requireText(root, "type");
    TaskEventType type =
        TaskEventType.fromCloudEventType(typeValue)
            .orElseThrow(() -> new MalformedEventException("Unknown event type: " + typeValue));
    Instant time = requireInstant(root, "time");
    String correlationId = requireText(root, "correlationid");
    JsonNode data = root.get("data");
    if (data == null || !data.isObject()) {
      throw new MalformedEventException("Event " + eventId + " has no data object");
    }

    TaskChangeEvent event =
        switch (type) {
          case CREATED -> new TaskCreatedEvent(eventId, correlationId, time, readTask(data));
          case UPDATED ->
              new TaskUpdatedEvent(
                  eventId, correlationId, time, readTask(data), readStrings(data, "changedFields"));
          case COMPLETED ->
              new TaskCompletedEvent(
                  eventId, correlationId, time, readTask(data), readRecurrence(data));
          case DELETED ->
              new TaskDeletedEvent(
                  eventId,
                  correlationId,
                  time,
                  requireUuid(data, "taskId"),
                  requireText(data, "userId"),
                  optionalUuid(data, "recurrenceRuleId"));
        };

    JsonNode partitionKey = root.get("partitionkey");
    if (partitionKey != null
        && !partitionKey.isNull()
        && !partitionKey.asText().equals(event.partitionKey())) {
      throw new MalformedEventException(
          "Event " + eventId + " partitionkey does not match its user id");
    }
    return event;
  }

  private ObjectNode encodeData(TaskChangeEvent event) {
    ObjectNode data = objectMapper.createObjectNode();
    if (event instanceof TaskDeletedEvent deleted) {
      data.put("taskId", deleted.taskId().toString());
      data.put("userId", deleted.userId());
      putUuid(data, "recurrenceRuleId", deleted.recurrenceRuleId());
      return data;
    }
    data.set("task", taskToJson(event.snapshot().orElseThrow()));
    if (event instanceof TaskUpdatedEvent updated) {
      ArrayNode fields = data.putArray("changedFields");
      updated.changedFields().forEach(fields::add);
    }
    if (event instanceof TaskCompletedEvent completed) {
      if (completed.recurrence() != null) {
        data.set("recurrence", writeRecurrence(completed.recurrence()));
      } else {
        data.putNull("recurrence");
      }
    }
    return data;
  }

  /** JSON form of a task snapshot, as carried in event data and client updates. */
  public ObjectNode taskToJson(TaskSnapshot task) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("taskId", task.taskId().toString());
    node.put("userId", task.userId());
    node.put("title", task.title());
    node.put("description", task.description());
    node.put("priority", task.priority());
    putInstant(node, "dueDate", task.dueDate());
    node.put("reminderOffsetMinutes", task.reminderOffsetMinutes());
    node.put("completed", task.completed());
    putInstant(node, "completedAt", task.completedAt());
    putUuid(node, "recurrenceRuleId", task.recurrenceRuleId());
    putUuid(node, "parentTaskId", task.parentTaskId());
    node.put("occurrenceNumber", task.occurrenceNumber());
    ArrayNode shared = node.putArray("sharedWith");
    task.sharedWith().forEach(shared::add);
    return node;
  }

  private TaskSnapshot readTask(JsonNode data) {
    JsonNode node = data.get("task");
    if (node == null || !node.isObject()) {
      throw new MalformedEventException("Event data has no task object");
    }
    JsonNode occurrence = node.get("occurrenceNumber");
    return new TaskSnapshot(
        requireUuid(node, "taskId"),
        requireText(node, "userId"),
        requireText(node, "title"),
        optionalText(node, "description"),
        optionalText(node, "priority"),
        optionalInstant(node, "dueDate"),
        optionalInt(node, "reminderOffsetMinutes"),
        node.path("completed").asBoolean(false),
        optionalInstant(node, "completedAt"),
        optionalUuid(node, "recurrenceRuleId"),
        optionalUuid(node, "parentTaskId"),
        occurrence != null && occurrence.canConvertToInt() ? occurrence.asInt() : 1,
        readStrings(node, "sharedWith"));
  }

  private ObjectNode writeRecurrence(RecurrenceSnapshot recurrence) {
    ObjectNode node = objectMapper.createObjectNode();
    putUuid(node, "ruleId", recurrence.ruleId());
    node.put("frequency", recurrence.frequency() != null ? recurrence.frequency().name() : null);
    node.put("interval", recurrence.interval());
    ArrayNode days = node.putArray("byWeekday");
    recurrence.byWeekday().stream().sorted().forEach(day -> days.add(day.name()));
    node.put("byMonthday", recurrence.byMonthday());
    node.put("endDate", recurrence.endDate() != null ? recurrence.endDate().toString() : null);
    node.put("maxOccurrences", recurrence.maxOccurrences());
    node.put("rrule", recurrence.rrule());
    return node;
  }

  private RecurrenceSnapshot readRecurrence(JsonNode data) {
    JsonNode node = data.get("recurrence");
    if (node == null || node.isNull()) {
      return null;
    }
    if (!node.isObject()) {
      throw new MalformedEventException("Event recurrence is not an object");
    }
    String frequency = requireText(node, "frequency");
    RecurrenceFrequency parsedFrequency;
    try {
      parsedFrequency = RecurrenceFrequency.valueOf(frequency);
    } catch (IllegalArgumentException e) {
      throw new MalformedEventException("Unknown recurrence frequency: " + frequency, e);
    }
    Set<DayOfWeek> weekdays = EnumSet.noneOf(DayOfWeek.class);
    for (String day : readStrings(node, "byWeekday")) {
      try {
        weekdays.add(DayOfWeek.valueOf(day));
      } catch (IllegalArgumentException e) {
        throw new MalformedEventException("Unknown weekday: " + day, e);
      }
    }
    String endDate = optionalText(node, "endDate");
    LocalDate parsedEndDate;
    try {
      parsedEndDate = endDate != null ? LocalDate.parse(endDate) : null;
    } catch (DateTimeException e) {
      throw new MalformedEventException("Invalid recurrence endDate: " + endDate, e);
    }
    return new RecurrenceSnapshot(
        optionalUuid(node, "ruleId"),
        parsedFrequency,
        node.path("interval").asInt(1),
        weekdays,
        optionalInt(node, "byMonthday"),
        parsedEndDate,
        optionalInt(node, "maxOccurrences"),
        optionalText(node, "rrule"));
  }

  private static String requireText(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isTextual() || value.asText().isBlank()) {
      throw new MalformedEventException("Missing or invalid attribute: " + field);
    }
    return value.asText();
  }

  private static String optionalText(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isTextual()) {
      throw new MalformedEventException("Attribute is not a string: " + field);
    }
    return value.asText();
  }

  private static Integer optionalInt(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.canConvertToInt() || !value.isIntegralNumber()) {
      throw new MalformedEventException("Attribute is not an integer: " + field);
    }
    return value.asInt();
  }

  private static UUID requireUuid(JsonNode node, String field) {
    String text = requireText(node, field);
    try {
      return UUID.fromString(text);
    } catch (IllegalArgumentException e) {
      throw new MalformedEventException("Attribute is not a UUID: " + field, e);
    }
  }

  private static UUID optionalUuid(JsonNode node, String field) {
    String text = optionalText(node, field);
    if (text == null) {
      return null;
    }
    try {
      return UUID.fromString(text);
    } catch (IllegalArgumentException e) {
      throw new MalformedEventException("Attribute is not a UUID: " + field, e);
    }
  }

  private static Instant requireInstant(JsonNode node, String field) {
    String text = requireText(node, field);
    try {
      return Instant.parse(text);
    } catch (DateTimeException e) {
      throw new MalformedEventException("Attribute is not an ISO-8601 instant: " + field, e);
    }
  }

  private static Instant optionalInstant(JsonNode node, String field) {
    String text = optionalText(node, field);
    if (text == null) {
      return null;
    }
    try {
      return Instant.parse(text);
    } catch (DateTimeException e) {
      throw new MalformedEventException("Attribute is not an ISO-8601 instant: " + field, e);
    }
  }

  private static List<String> readStrings(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return List.of();
    }
    if (!value.isArray()) {
      throw new MalformedEventException("Attribute is not an array: " + field);
    }
    List<String> result = new ArrayList<>();
    for (JsonNode element : value) {
      if (!element.isTextual()) {
        throw new MalformedEventException("Array element is not a string: " + field);
      }
      result.add(element.asText());
    }
    return result;
  }

  private static void putUuid(ObjectNode node, String field, UUID value) {
    node.put(field, value != null ? value.toString() : null);
  }

  private static void putInstant(ObjectNode node, String field, Instant value) {
    node.put(field, value != null ? value.toString() : null);
  }
}

package io.todoflow.taskevents.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.todoflow.taskevents.event.TaskChangeEvent;
import io.todoflow.taskevents.event.TaskEventCodec;
import java.time.Instant;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Renders server-to-client WebSocket messages. Every message carries a {@code type}. */
@Component
public class ServerMessages {

  private final ObjectMapper objectMapper;
  private final TaskEventCodec codec;

  public ServerMessages(ObjectMapper objectMapper, TaskEventCodec codec) {
    this.objectMapper = objectMapper;
    this.codec = codec;
  }

  public String subscribed(Set<SubscriptionScope> scopes, long latestSequence) {
    ObjectNode node = message("subscribed");
    ArrayNode scopeNames = node.putArray("scopes");
    scopes.stream().sorted().forEach(scope -> scopeNames.add(scope.wireName()));
    node.put("latestSequence", latestSequence);
    return write(node);
  }

  public String unsubscribed() {
    return write(message("unsubscribed"));
  }

  public String pong(JsonNode clientTimestamp, Instant serverTime) {
    ObjectNode node = message("pong");
    if (clientTimestamp != null && !clientTimestamp.isMissingNode()) {
      node.set("timestamp", clientTimestamp);
    } else {
      node.putNull("timestamp");
    }
    node.put("serverTime", serverTime.toString());
    return write(node);
  }

  public String update(TaskChangeEvent event, long sequence) {
    ObjectNode node = message("update");
    node.put("taskId", event.taskId().toString());
    node.put("change", event.eventType().change());
    node.put("sequence", sequence);
    node.put("eventId", event.eventId().toString());
    node.put("correlationId", event.correlationId());
    node.put("occurredAt", event.occurredAt().toString());
    event
        .snapshot()
        .ifPresentOrElse(
            task -> node.set("task", codec.taskToJson(task)), () -> node.putNull("task"));
    return write(node);
  }

  public String resync(String reason, long latestSequence) {
    ObjectNode node = message("resync");
    node.put("reason", reason);
    node.put("latestSequence", latestSequence);
    return write(node);
  }

  public String error(String code, String detail) {
    ObjectNode node = message("error");
    node.put("code", code);
    node.put("message", detail);
    return write(node);
  }

  private ObjectNode message(String type) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("type", type);
    return node;
  }

  private String write(ObjectNode node) {
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to render " + node.path("type").asText(), e);
    }
  }
}

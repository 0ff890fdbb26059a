package io.todoflow.taskevents.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.todoflow.taskevents.logging.CorrelationIds;
import io.todoflow.taskevents.logging.EventLogContext;
import java.io.IOException;
import java.time.Clock;
import java.util.EnumSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Client side of the task update stream. Handles the connection lifecycle and the client control
 * messages {@code subscribe}, {@code unsubscribe} and {@code ping}.
 */
@Component
public class TaskUpdateWebSocketHandler extends TextWebSocketHandler {

  private static final Logger log = LoggerFactory.getLogger(TaskUpdateWebSocketHandler.class);

  static final String ERROR_INVALID_MESSAGE = "invalid_message";
  static final String ERROR_UNKNOWN_TYPE = "unknown_type";
  static final String ERROR_INVALID_STATE = "invalid_state";

  private final ConnectionRegistry registry;
  private final TaskUpdateFanOutService fanOutService;
  private final ServerMessages messages;
  private final ObjectMapper objectMapper;
  private final FanOutProperties properties;
  private final Clock clock;

  public TaskUpdateWebSocketHandler(
      ConnectionRegistry registry,
      TaskUpdateFanOutService fanOutService,
      ServerMessages messages,
      ObjectMapper objectMapper,
      FanOutProperties properties,
      Clock clock) {
    this.registry = registry;
    this.fanOutService = fanOutService;
    this.messages = messages;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    String userId =
        (String) session.getAttributes().get(TokenHandshakeInterceptor.USER_ID_ATTRIBUTE);
    if (userId == null) {
      log.warn("Closing unauthenticated WebSocket session {}", session.getId());
      closeQuietly(session, CloseStatus.POLICY_VIOLATION);
      return;
    }
    var decorated =
        new ConcurrentWebSocketSessionDecorator(
            session,
            (int) properties.sendTimeLimit().toMillis(),
            properties.sendBufferSizeLimit(),
            properties.overflowStrategy());
    var connection =
        new ClientConnection(
            session.getId(),
            userId,
            decorated,
            (Long) session.getAttributes().get(TokenHandshakeInterceptor.LAST_SEEN_ATTRIBUTE),
            clock.instant());
    connection.open();
    registry.register(connection);
    log.info(
        "WebSocket connection {} opened for user {} ({} open on this instance)",
        connection.connectionId(),
        userId,
        registry.size());
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message)
      throws IOException {
    var connection = registry.find(session.getId()).orElse(null);
    if (connection == null) {
      return;
    }
    connection.touch(clock.instant());
    MDC.put(EventLogContext.MDC_CORRELATION_ID, CorrelationIds.generate());
    try {
      if (!connection.state().acceptsControlMessages()) {
        connection.send(
            messages.error(ERROR_INVALID_STATE, "Connection is " + connection.state()));
        return;
      }
      JsonNode node;
      try {
        node = objectMapper.readTree(message.getPayload());
      } catch (JsonProcessingException e) {
        connection.send(messages.error(ERROR_INVALID_MESSAGE, "Message is not valid JSON"));
        return;
      }
      if (node == null || !node.isObject() || !node.path("type").isTextual()) {
        connection.send(messages.error(ERROR_INVALID_MESSAGE, "Message has no type"));
        return;
      }

      String type = node.get("type").asText();
      switch (type) {
        case "subscribe" -> handleSubscribe(connection, node);
        case "unsubscribe" -> {
          connection.unsubscribe();
          connection.send(messages.unsubscribed());
        }
        case "ping" -> connection.send(messages.pong(node.get("timestamp"), clock.instant()));
        default -> connection.send(messages.error(ERROR_UNKNOWN_TYPE, "Unknown type: " + type));
      }
    } finally {
      MDC.remove(EventLogContext.MDC_CORRELATION_ID);
    }
  }

  private void handleSubscribe(ClientConnection connection, JsonNode node) throws IOException {
    Set<SubscriptionScope> scopes = EnumSet.noneOf(SubscriptionScope.class);
    JsonNode requested = node.get("scopes");
    if (requested != null && requested.isArray()) {
      for (JsonNode scope : requested) {
        SubscriptionScope.fromWireName(scope.asText()).ifPresent(scopes::add);
      }
    }
    Long lastSeen = null;
    JsonNode lastSeenNode = node.get("lastSeenSequence");
    if (lastSeenNode != null && !lastSeenNode.isNull()) {
      if (!lastSeenNode.canConvertToLong() || !lastSeenNode.isIntegralNumber()) {
        connection.send(
            messages.error(ERROR_INVALID_MESSAGE, "lastSeenSequence must be an integer"));
        return;
      }
      lastSeen = lastSeenNode.asLong();
    }
    fanOutService.subscribe(connection, scopes, lastSeen);
    log.debug(
        "Connection {} subscribed scopes={} lastSeen={}",
        connection.connectionId(),
        connection.scopes(),
        lastSeen);
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.warn(
        "Transport error on WebSocket session {}: {}", session.getId(), exception.getMessage());
    registry
        .find(session.getId())
        .ifPresentOrElse(
            connection -> registry.close(connection, CloseStatus.SERVER_ERROR),
            () -> closeQuietly(session, CloseStatus.SERVER_ERROR));
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    registry
        .remove(session.getId())
        .ifPresent(
            connection -> {
              connection.close(status);
              log.info(
                  "WebSocket connection {} of user {} closed: {}",
                  connection.connectionId(),
                  connection.userId(),
                  status);
            });
  }

  private static void closeQuietly(WebSocketSession session, CloseStatus status) {
    try {
      session.close(status);
    } catch (IOException e) {
      log.debug("Error closing WebSocket session {}: {}", session.getId(), e.getMessage());
    }
  }
}

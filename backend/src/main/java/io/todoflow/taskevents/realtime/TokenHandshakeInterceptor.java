package io.todoflow.taskevents.realtime;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Authenticates the WebSocket upgrade from the {@code token} query parameter and records the user
 * id, plus the optional {@code lastSeenSequence} parameter, as session attributes. A failed check
 * answers 401 and the upgrade never happens.
 */
@Component
public class TokenHandshakeInterceptor implements HandshakeInterceptor {

  private static final Logger log = LoggerFactory.getLogger(TokenHandshakeInterceptor.class);

  public static final String USER_ID_ATTRIBUTE = "taskflow.userId";
  public static final String LAST_SEEN_ATTRIBUTE = "taskflow.lastSeenSequence";

  private final WebSocketTokenVerifier tokenVerifier;

  public TokenHandshakeInterceptor(WebSocketTokenVerifier tokenVerifier) {
    this.tokenVerifier = tokenVerifier;
  }

  @Override
  public boolean beforeHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Map<String, Object> attributes) {
    var params = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams();
    try {
      String userId = tokenVerifier.verify(params.getFirst("token"));
      attributes.put(USER_ID_ATTRIBUTE, userId);
    } catch (WebSocketAuthException e) {
      log.info(
          "Rejected WebSocket handshake from {}: {}",
          request.getRemoteAddress(),
          e.getBody().getDetail());
      response.setStatusCode(HttpStatus.UNAUTHORIZED);
      return false;
    }

    String lastSeen = params.getFirst("lastSeenSequence");
    if (lastSeen != null && !lastSeen.isBlank()) {
      try {
        attributes.put(LAST_SEEN_ATTRIBUTE, Long.parseLong(lastSeen.trim()));
      } catch (NumberFormatException e) {
        log.debug("Ignoring invalid lastSeenSequence {}", lastSeen);
      }
    }
    return true;
  }

  @Override
  public void afterHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Exception exception) {
    if (exception != null) {
      log.warn("WebSocket handshake failed: {}", exception.getMessage());
    }
  }
}

package io.todoflow.taskevents.realtime;

import static org.assertj.core.api.Assertions.assertThat;

import io.todoflow.taskevents.MutableClock;
import io.todoflow.taskevents.event.TestEvents;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class TokenHandshakeInterceptorTest {

  private final TokenHandshakeInterceptor interceptor =
      new TokenHandshakeInterceptor(
          new WebSocketTokenVerifier(TestTokens.SECRET, new MutableClock(TestEvents.NOW)));

  private final MockHttpServletResponse servletResponse = new MockHttpServletResponse();
  private final Map<String, Object> attributes = new HashMap<>();

  @Test
  void validToken_storesUserAndLastSeenSequence() {
    var token = TestTokens.token("user-1", TestEvents.NOW.plus(Duration.ofHours(1)));

    boolean accepted = handshake("token=" + token + "&lastSeenSequence=17");

    assertThat(accepted).isTrue();
    assertThat(attributes)
        .containsEntry(TokenHandshakeInterceptor.USER_ID_ATTRIBUTE, "user-1")
        .containsEntry(TokenHandshakeInterceptor.LAST_SEEN_ATTRIBUTE, 17L);
  }

  @Test
  void invalidLastSeenSequence_isIgnored() {
    var token = TestTokens.token("user-1", TestEvents.NOW.plus(Duration.ofHours(1)));

    boolean accepted = handshake("token=" + token + "&lastSeenSequence=abc");

    assertThat(accepted).isTrue();
    assertThat(attributes).doesNotContainKey(TokenHandshakeInterceptor.LAST_SEEN_ATTRIBUTE);
  }

  @Test
  void missingToken_answersUnauthorized() {
    boolean accepted = handshake(null);

    assertThat(accepted).isFalse();
    assertThat(servletResponse.getStatus()).isEqualTo(401);
    assertThat(attributes).isEmpty();
  }

  @Test
  void expiredToken_answersUnauthorized() {
    var token = TestTokens.token("user-1", TestEvents.NOW.minus(Duration.ofMinutes(5)));

    boolean accepted = handshake("token=" + token);

    assertThat(accepted).isFalse();
    assertThat(servletResponse.getStatus()).isEqualTo(401);
  }

  private boolean handshake(String query) {
    var servletRequest = new MockHttpServletRequest("GET", "/ws/tasks");
    servletRequest.setQueryString(query);
    return interceptor.beforeHandshake(
        new ServletServerHttpRequest(servletRequest),
        new ServletServerHttpResponse(servletResponse),
        null,
        attributes);
  }
}

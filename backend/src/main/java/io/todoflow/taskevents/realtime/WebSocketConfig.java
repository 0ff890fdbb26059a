package io.todoflow.taskevents.realtime;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private final TaskUpdateWebSocketHandler handler;
  private final TokenHandshakeInterceptor handshakeInterceptor;
  private final FanOutProperties properties;

  public WebSocketConfig(
      TaskUpdateWebSocketHandler handler,
      TokenHandshakeInterceptor handshakeInterceptor,
      FanOutProperties properties) {
    this.handler = handler;
    this.handshakeInterceptor = handshakeInterceptor;
    this.properties = properties;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry
        .addHandler(handler, properties.path())
        .addInterceptors(handshakeInterceptor)
        .setAllowedOriginPatterns(properties.allowedOrigins().toArray(String[]::new));
  }
}

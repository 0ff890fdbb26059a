package io.todoflow.taskevents.realtime;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator.OverflowStrategy;

/**
 * WebSocket fan-out settings. {@code instanceId} names this instance's consumer group; when blank
 * a random id is generated at startup, which gives every instance its own group.
 */
@ConfigurationProperties("taskflow.fanout")
public record FanOutProperties(
    @DefaultValue("/ws/tasks") String path,
    @DefaultValue("") String instanceId,
    @DefaultValue("200") int replayBufferSize,
    @DefaultValue("5m") Duration replayRetention,
    @DefaultValue("1h") Duration userLogExpiry,
    @DefaultValue("10s") Duration sendTimeLimit,
    @DefaultValue("524288") int sendBufferSizeLimit,
    @DefaultValue("TERMINATE") OverflowStrategy overflowStrategy,
    @DefaultValue("90s") Duration idleTimeout,
    @DefaultValue("*") List<String> allowedOrigins) {}

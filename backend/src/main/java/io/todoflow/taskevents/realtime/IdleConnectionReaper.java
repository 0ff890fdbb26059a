package io.todoflow.taskevents.realtime;

import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

/** Closes connections that sent nothing, not even a ping, within the idle timeout. */
@Component
public class IdleConnectionReaper {

  private static final Logger log = LoggerFactory.getLogger(IdleConnectionReaper.class);

  private static final CloseStatus IDLE_TIMEOUT = CloseStatus.SESSION_NOT_RELIABLE;

  private final ConnectionRegistry registry;
  private final FanOutProperties properties;
  private final Clock clock;

  public IdleConnectionReaper(
      ConnectionRegistry registry, FanOutProperties properties, Clock clock) {
    this.registry = registry;
    this.properties = properties;
    this.clock = clock;
  }

  /** Returns the number of connections closed. */
  @Scheduled(fixedDelayString = "${taskflow.fanout.reap-interval-ms:15000}")
  public int reapIdleConnections() {
    Instant cutoff = clock.instant().minus(properties.idleTimeout());
    int closed = 0;
    for (ClientConnection connection : registry.all()) {
      if (connection.isIdleSince(cutoff)) {
        log.info(
            "Closing idle connection {} of user {}, last activity {}",
            connection.connectionId(),
            connection.userId(),
            connection.lastActivity());
        registry.close(connection, IDLE_TIMEOUT);
        closed++;
      }
    }
    return closed;
  }
}

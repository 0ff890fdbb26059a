package io.todoflow.taskevents.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import io.todoflow.taskevents.MutableClock;
import io.todoflow.taskevents.event.TestEvents;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.WebSocketSession;

class IdleConnectionReaperTest {

  private final MutableClock clock = new MutableClock(TestEvents.NOW);
  private final ConnectionRegistry registry = new ConnectionRegistry();
  private final IdleConnectionReaper reaper =
      new IdleConnectionReaper(registry, RealtimeFixtures.properties(10), clock);

  @Test
  void closesOnlyConnectionsIdleLongerThanTimeout() {
    var quiet = connect("c1");
    var chatty = connect("c2");
    clock.advance(Duration.ofSeconds(60));
    chatty.touch(clock.instant());
    clock.advance(Duration.ofSeconds(31));

    int closed = reaper.reapIdleConnections();

    assertThat(closed).isEqualTo(1);
    assertThat(quiet.state()).isEqualTo(ConnectionState.CLOSED);
    assertThat(registry.find("c1")).isEmpty();
    assertThat(registry.find("c2")).contains(chatty);
  }

  @Test
  void nothingIdle_closesNothing() {
    connect("c1");
    clock.advance(Duration.ofSeconds(89));

    assertThat(reaper.reapIdleConnections()).isZero();
  }

  private ClientConnection connect(String id) {
    var connection =
        new ClientConnection(id, "user-1", mock(WebSocketSession.class), null, clock.instant());
    connection.open();
    registry.register(connection);
    return connection;
  }
}

package io.todoflow.taskevents.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import io.todoflow.taskevents.event.TestEvents;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.WebSocketSession;

class ConnectionRegistryTest {

  private final WebSocketSession session = mock(WebSocketSession.class);
  private final ConnectionRegistry registry = new ConnectionRegistry();

  @Test
  void remove_keepsOtherConnectionsOfTheUser() {
    registry.register(connection("c1", "user-1"));
    registry.register(connection("c2", "user-1"));

    registry.remove("c1");

    assertThat(registry.connectionsFor("user-1"))
        .extracting(ClientConnection::connectionId)
        .containsExactly("c2");
    assertThat(registry.find("c1")).isEmpty();
  }

  @Test
  void remove_unknownConnection_isEmpty() {
    assertThat(registry.remove("missing")).isEmpty();
  }

  @Test
  void reconnectWhileOldConnectionCloses_neverLosesTheNewConnection() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      for (int i = 0; i < 5_000; i++) {
        String oldId = "old-" + i;
        String newId = "new-" + i;
        registry.register(connection(oldId, "user-1"));
        var barrier = new CyclicBarrier(2);
        var removal =
            CompletableFuture.runAsync(
                () -> {
                  await(barrier);
                  registry.remove(oldId);
                },
                pool);
        var registration =
            CompletableFuture.runAsync(
                () -> {
                  await(barrier);
                  registry.register(connection(newId, "user-1"));
                },
                pool);
        CompletableFuture.allOf(removal, registration).get(5, TimeUnit.SECONDS);

        assertThat(registry.connectionsFor("user-1"))
            .extracting(ClientConnection::connectionId)
            .containsExactly(newId);
        registry.remove(newId);
      }
    } finally {
      pool.shutdownNow();
    }
  }

  private ClientConnection connection(String id, String userId) {
    return new ClientConnection(id, userId, session, null, TestEvents.NOW);
  }

  private static void await(CyclicBarrier barrier) {
    try {
      barrier.await(5, TimeUnit.SECONDS);
    } catch (Exception e) {
      throw new IllegalStateException(e);
    }
  }
}

package io.todoflow.taskevents.realtime;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

/** Live connections of this instance, by connection id and by user. */
@Component
public class ConnectionRegistry {

  private final ConcurrentMap<String, ClientConnection> connections = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Set<String>> connectionsByUser = new ConcurrentHashMap<>();

  public void register(ClientConnection connection) {
    connections.put(connection.connectionId(), connection);
    connectionsByUser.compute(
        connection.userId(),
        (user, ids) -> {
          Set<String> updated = ids != null ? ids : ConcurrentHashMap.newKeySet();
          updated.add(connection.connectionId());
          return updated;
        });
  }

  public Optional<ClientConnection> find(String connectionId) {
    return Optional.ofNullable(connections.get(connectionId));
  }

  public List<ClientConnection> connectionsFor(String userId) {
    var ids = connectionsByUser.get(userId);
    if (ids == null) {
      return List.of();
    }
    return ids.stream().map(connections::get).filter(c -> c != null).toList();
  }

  public Collection<ClientConnection> all() {
    return List.copyOf(connections.values());
  }

  public int size() {
    return connections.size();
  }

  public Optional<ClientConnection> remove(String connectionId) {
    var connection = connections.remove(connectionId);
    if (connection == null) {
      return Optional.empty();
    }
    connectionsByUser.computeIfPresent(
        connection.userId(),
        (user, ids) -> {
          ids.remove(connectionId);
          return ids.isEmpty() ? null : ids;
        });
    return Optional.of(connection);
  }

  /** Removes the connection and closes its session. */
  public void close(ClientConnection connection, CloseStatus status) {
    remove(connection.connectionId());
    connection.close(status);
  }
}

package io.todoflow.taskevents.realtime;

import java.io.IOException;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * One authenticated WebSocket connection. Replay on subscribe and live delivery synchronize on
 * the connection, and an update is only sent if its sequence is newer than the last one sent, so
 * a client never sees an update twice or out of order.
 */
public class ClientConnection {

  private static final Logger log = LoggerFactory.getLogger(ClientConnection.class);

  private final String connectionId;
  private final String userId;
  private final WebSocketSession session;
  private Long handshakeLastSeenSequence;
  private final Instant connectedAt;

  private ConnectionState state = ConnectionState.CONNECTING;
  private Set<SubscriptionScope> scopes = EnumSet.noneOf(SubscriptionScope.class);
  private long lastSentSequence;
  private volatile Instant lastActivity;

  public ClientConnection(
      String connectionId,
      String userId,
      WebSocketSession session,
      Long handshakeLastSeenSequence,
      Instant connectedAt) {
    this.connectionId = connectionId;
    this.userId = userId;
    this.session = session;
    this.handshakeLastSeenSequence = handshakeLastSeenSequence;
    this.connectedAt = connectedAt;
    this.lastActivity = connectedAt;
  }

  public synchronized void open() {
    transitionTo(ConnectionState.OPEN);
  }

  /**
   * Subscribes to {@code requestedScopes} and brings the client up to date from {@code lastSeen}:
   * replaying buffered updates, or sending a resync when they are no longer available. Without a
   * last seen sequence (from the message or the handshake) the client starts from the current end
   * of the stream.
   */
  public synchronized void subscribe(
      Set<SubscriptionScope> requestedScopes,
      Long lastSeen,
      UserUpdateLog updateLog,
      ServerMessages messages,
      Instant now)
      throws IOException {
    transitionTo(ConnectionState.SUBSCRIBED);
    this.scopes =
        requestedScopes.isEmpty()
            ? EnumSet.of(SubscriptionScope.OWN_TASKS)
            : EnumSet.copyOf(requestedScopes);

    // the handshake sequence only applies to the first subscribe
    Long from = lastSeen != null ? lastSeen : handshakeLastSeenSequence;
    handshakeLastSeenSequence = null;
    if (from == null) {
      lastSentSequence = updateLog.latestSequence();
      send(messages.subscribed(scopes, lastSentSequence));
      return;
    }

    CatchUp catchUp = updateLog.catchUp(from, now);
    send(messages.subscribed(scopes, catchUp.latestSequence()));
    switch (catchUp.kind()) {
      case UP_TO_DATE -> lastSentSequence = catchUp.latestSequence();
      case RESYNC -> {
        send(messages.resync(catchUp.reason(), catchUp.latestSequence()));
        lastSentSequence = catchUp.latestSequence();
      }
      case REPLAY -> {
        for (UpdateEntry entry : catchUp.entries()) {
          if (scopes.contains(entry.scope())) {
            send(entry.message());
          }
        }
        lastSentSequence = catchUp.latestSequence();
        log.debug(
            "Replayed {} updates to connection {} from sequence {}",
            catchUp.entries().size(),
            connectionId,
            from);
      }
    }
  }

  public synchronized void unsubscribe() {
    if (state == ConnectionState.SUBSCRIBED) {
      transitionTo(ConnectionState.OPEN);
      scopes = EnumSet.noneOf(SubscriptionScope.class);
    }
  }

  /**
   * Sends a live update if this connection is subscribed to its scope and has not already been
   * sent it.
   *
   * @return true if the update was sent
   */
  public synchronized boolean deliver(UpdateEntry entry) throws IOException {
    if (state != ConnectionState.SUBSCRIBED
        || !scopes.contains(entry.scope())
        || entry.sequence() <= lastSentSequence) {
      return false;
    }
    send(entry.message());
    lastSentSequence = entry.sequence();
    return true;
  }

  public void send(String message) throws IOException {
    session.sendMessage(new TextMessage(message));
  }

  public synchronized void close(CloseStatus status) {
    if (state == ConnectionState.CLOSED) {
      return;
    }
    state = ConnectionState.CLOSED;
    if (session.isOpen()) {
      try {
        session.close(status);
      } catch (IOException e) {
        log.debug("Error closing connection {}: {}", connectionId, e.getMessage());
      }
    }
  }

  public void touch(Instant now) {
    this.lastActivity = now;
  }

  public boolean isIdleSince(Instant cutoff) {
    return lastActivity.isBefore(cutoff);
  }

  private void transitionTo(ConnectionState target) {
    if (!state.canTransitionTo(target)) {
      throw new IllegalStateException(
          "Connection " + connectionId + " cannot move from " + state + " to " + target);
    }
    state = target;
  }

  public String connectionId() {
    return connectionId;
  }

  public String userId() {
    return userId;
  }

  public synchronized ConnectionState state() {
    return state;
  }

  public synchronized Set<SubscriptionScope> scopes() {
    return Set.copyOf(scopes);
  }

  public synchronized long lastSentSequence() {
    return lastSentSequence;
  }

  public Instant connectedAt() {
    return connectedAt;
  }

  public Instant lastActivity() {
    return lastActivity;
  }
}

package io.todoflow.taskevents.realtime;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.LongFunction;

/**
 * A user's update stream on this instance: a monotonically increasing sequence and a bounded
 * replay buffer, limited by entry count and age.
 */
public class UserUpdateLog {

  static final String REASON_BUFFER_EXCEEDED = "buffer_exceeded";
  static final String REASON_SEQUENCE_AHEAD = "sequence_ahead";

  private final int capacity;
  private final Duration retention;
  private final Deque<UpdateEntry> entries = new ArrayDeque<>();
  private long latestSequence;

  public UserUpdateLog(int capacity, Duration retention) {
    this.capacity = Math.max(1, capacity);
    this.retention = retention;
  }

  /** Assigns the next sequence, renders the message for it and buffers the entry. */
  public synchronized UpdateEntry append(
      SubscriptionScope scope, LongFunction<String> render, Instant now) {
    long sequence = latestSequence + 1;
    var entry = new UpdateEntry(sequence, scope, render.apply(sequence), now);
    latestSequence = sequence;
    entries.addLast(entry);
    evict(now);
    return entry;
  }

  public synchronized long latestSequence() {
    return latestSequence;
  }

  /**
   * Works out what a client that has seen everything up to {@code lastSeen} is missing: nothing,
   * a replay of the buffered entries after it, or a resync when the buffer no longer reaches back
   * that far or the client is ahead of this stream.
   */
  public synchronized CatchUp catchUp(long lastSeen, Instant now) {
    evict(now);
    if (lastSeen == latestSequence) {
      return CatchUp.upToDate(latestSequence);
    }
    if (lastSeen > latestSequence) {
      return CatchUp.resync(latestSequence, REASON_SEQUENCE_AHEAD);
    }
    long oldestBuffered = entries.isEmpty() ? latestSequence + 1 : entries.peekFirst().sequence();
    if (lastSeen + 1 < oldestBuffered) {
      return CatchUp.resync(latestSequence, REASON_BUFFER_EXCEEDED);
    }
    List<UpdateEntry> missed = new ArrayList<>();
    for (UpdateEntry entry : entries) {
      if (entry.sequence() > lastSeen) {
        missed.add(entry);
      }
    }
    return CatchUp.replay(missed, latestSequence);
  }

  private void evict(Instant now) {
    Instant cutoff = now.minus(retention);
    while (!entries.isEmpty()
        && (entries.size() > capacity || entries.peekFirst().recordedAt().isBefore(cutoff))) {
      entries.removeFirst();
    }
  }
}

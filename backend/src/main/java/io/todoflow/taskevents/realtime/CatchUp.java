package io.todoflow.taskevents.realtime;

import java.util.List;

/** Result of comparing a client's last seen sequence with a user's update stream. */
public record CatchUp(Kind kind, List<UpdateEntry> entries, long latestSequence, String reason) {

  public enum Kind {
    UP_TO_DATE,
    REPLAY,
    RESYNC
  }

  public CatchUp {
    entries = List.copyOf(entries);
  }

  static CatchUp upToDate(long latestSequence) {
    return new CatchUp(Kind.UP_TO_DATE, List.of(), latestSequence, null);
  }

  static CatchUp replay(List<UpdateEntry> entries, long latestSequence) {
    return new CatchUp(Kind.REPLAY, entries, latestSequence, null);
  }

  static CatchUp resync(long latestSequence, String reason) {
    return new CatchUp(Kind.RESYNC, List.of(), latestSequence, reason);
  }
}

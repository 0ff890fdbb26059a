package io.todoflow.taskevents.publisher;

public enum PublishOutcome {
  PUBLISHED,
  /** The broker refused or was unreachable; the event waits in the local retry queue. */
  QUEUED_FOR_RETRY,
  /** The local retry queue is full; the event is lost. */
  REJECTED;

  PublishOutcome worst(PublishOutcome other) {
    return other.ordinal() > ordinal() ? other : this;
  }
}

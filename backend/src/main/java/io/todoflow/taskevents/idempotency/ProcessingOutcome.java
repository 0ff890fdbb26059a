package io.todoflow.taskevents.idempotency;

public enum ProcessingOutcome {
  APPLIED,
  SKIPPED_ALREADY_PROCESSED
}

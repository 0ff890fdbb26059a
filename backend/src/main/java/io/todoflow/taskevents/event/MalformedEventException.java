package io.todoflow.taskevents.event;

/** A broker payload that cannot be decoded into a {@link TaskChangeEvent}. */
public class MalformedEventException extends RuntimeException {

  public MalformedEventException(String message) {
    super(message);
  }

  public MalformedEventException(String message, Throwable cause) {
    super(message, cause);
  }
}

package io.todoflow.taskevents.reminder;

public class ReminderDeliveryException extends RuntimeException {

  public ReminderDeliveryException(String message) {
    super(message);
  }

  public ReminderDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}

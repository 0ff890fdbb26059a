package io.todoflow.taskevents.reminder;

/**
 * A reminder delivery mechanism. Channels register themselves as beans and are looked up by
 * {@link #channelId()}.
 */
public interface ReminderChannel {

  String EMAIL = "email";
  String PUSH = "push";

  String channelId();

  /**
   * Delivers one reminder batch.
   *
   * @throws ReminderDeliveryException if the channel could not deliver
   */
  void deliver(ReminderDelivery delivery);

  default boolean isEnabled() {
    return true;
  }
}

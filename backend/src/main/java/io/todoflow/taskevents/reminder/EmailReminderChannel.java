package io.todoflow.taskevents.reminder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Email delivery, simulated by logging the message that would be sent. */
@Component
public class EmailReminderChannel implements ReminderChannel {

  private static final Logger log = LoggerFactory.getLogger(EmailReminderChannel.class);

  @Override
  public String channelId() {
    return EMAIL;
  }

  @Override
  public void deliver(ReminderDelivery delivery) {
    log.info(
        "Email reminder to user={} subject=\"{}\" tasks={}",
        delivery.userId(),
        delivery.subject(),
        delivery.items().stream().map(ReminderDelivery.Item::taskId).toList());
  }
}

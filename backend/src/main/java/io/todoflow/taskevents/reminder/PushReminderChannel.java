package io.todoflow.taskevents.reminder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Push delivery, simulated by logging. */
@Component
public class PushReminderChannel implements ReminderChannel {

  private static final Logger log = LoggerFactory.getLogger(PushReminderChannel.class);

  @Override
  public String channelId() {
    return PUSH;
  }

  @Override
  public void deliver(ReminderDelivery delivery) {
    log.info(
        "Push reminder to user={} title=\"{}\" count={}",
        delivery.userId(),
        delivery.subject(),
        delivery.items().size());
  }
}

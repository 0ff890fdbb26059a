package io.todoflow.taskevents.reminder;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes reminder deliveries to channels. Channels self-register via constructor injection
 * (Spring collects all ReminderChannel beans).
 */
@Component
public class ReminderDispatcher {

  private static final Logger log = LoggerFactory.getLogger(ReminderDispatcher.class);

  private final Map<String, ReminderChannel> channels;

  public ReminderDispatcher(List<ReminderChannel> channelBeans) {
    this.channels =
        channelBeans.stream()
            .filter(ReminderChannel::isEnabled)
            .collect(Collectors.toMap(ReminderChannel::channelId, Function.identity()));
  }

  /**
   * Delivers to each requested channel. A delivery counts as successful when at least one channel
   * accepted it.
   *
   * @return the channels that delivered
   * @throws ReminderDeliveryException if no channel delivered
   */
  public Set<String> dispatch(ReminderDelivery delivery, Set<String> channelIds) {
    Set<String> delivered = new LinkedHashSet<>();
    List<String> failures = new ArrayList<>();
    for (String channelId : channelIds) {
      var channel = channels.get(channelId);
      if (channel == null) {
        failures.add(channelId + ": channel unavailable");
        continue;
      }
      try {
        channel.deliver(delivery);
        delivered.add(channelId);
      } catch (RuntimeException e) {
        log.warn(
            "Failed to deliver reminder via channel={} userId={}",
            channelId,
            delivery.userId(),
            e);
        failures.add(channelId + ": " + e.getMessage());
      }
    }
    if (delivered.isEmpty()) {
      throw new ReminderDeliveryException(
          "No channel delivered the reminder (" + String.join("; ", failures) + ")");
    }
    return delivered;
  }
}

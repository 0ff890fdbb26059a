package io.todoflow.taskevents.realtime;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

/**
 * Holds the per-user update logs of this instance. Logs of users with no activity for {@code
 * userLogExpiry} are evicted; their sequence restarts and reconnecting clients get a resync.
 */
@Component
public class UpdateSequencer {

  private final FanOutProperties properties;
  private final Cache<String, UserUpdateLog> logs;

  public UpdateSequencer(FanOutProperties properties) {
    this.properties = properties;
    this.logs = Caffeine.newBuilder().expireAfterAccess(properties.userLogExpiry()).build();
  }

  public UserUpdateLog logFor(String userId) {
    return logs.get(
        userId,
        id -> new UserUpdateLog(properties.replayBufferSize(), properties.replayRetention()));
  }
}

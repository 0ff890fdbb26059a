package io.todoflow.taskevents.broker;

import io.todoflow.taskevents.config.BrokerProperties;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * In-process partitioned log with consumer groups. Each topic holds {@code partitions}
 * append-only lists; a record's partition is derived from its key. Within a group every partition
 * is owned by at most one live subscription, assigned round-robin in join order, and a
 * subscription that takes over a partition resumes from the group's committed offset.
 *
 * <p>Records older than the retention window are pruned from the head of each partition.
 */
@Component
@ConditionalOnProperty(
    name = "taskflow.broker.type",
    havingValue = "in-memory",
    matchIfMissing = true)
public class InMemoryEventBroker implements EventBroker {

  private static final Logger log = LoggerFactory.getLogger(InMemoryEventBroker.class);

  private final int partitionCount;
  private final Duration retention;
  private final int maxPollRecords;
  private final Clock clock;
  private final ConcurrentMap<String, TopicLog> topics = new ConcurrentHashMap<>();
  private volatile boolean closed;

  @Autowired
  public InMemoryEventBroker(BrokerProperties properties, Clock clock) {
    this(properties.partitions(), properties.retention(), properties.maxPollRecords(), clock);
  }

  public InMemoryEventBroker(
      int partitionCount, Duration retention, int maxPollRecords, Clock clock) {
    if (partitionCount < 1) {
      throw new IllegalArgumentException("partitionCount must be >= 1");
    }
    this.partitionCount = partitionCount;
    this.retention = retention;
    this.maxPollRecords = Math.max(1, maxPollRecords);
    this.clock = clock;
  }

  @Override
  public BrokerRecord publish(String topic, String key, String payload) {
    if (closed) {
      throw new BrokerUnavailableException("In-memory broker is shut down");
    }
    return topic(topic).append(key, payload);
  }

  @Override
  public BrokerSubscription subscribe(String topic, String consumerGroup) {
    if (closed) {
      throw new BrokerUnavailableException("In-memory broker is shut down");
    }
    return topic(topic).join(consumerGroup);
  }

  public int partitionCount() {
    return partitionCount;
  }

  /** Offset the group will resume from on {@code partition}; 0 when nothing was committed. */
  public long committedOffset(String topic, String consumerGroup, int partition) {
    return topic(topic).committed(consumerGroup, partition);
  }

  public long endOffset(String topic, int partition) {
    return topic(topic).endOffset(partition);
  }

  @Scheduled(fixedDelayString = "${taskflow.broker.prune-interval-ms:60000}")
  public void pruneExpired() {
    Instant cutoff = clock.instant().minus(retention);
    int removed = 0;
    for (TopicLog topicLog : topics.values()) {
      removed += topicLog.prune(cutoff);
    }
    if (removed > 0) {
      log.info("Pruned {} records older than {}", removed, cutoff);
    }
  }

  @PreDestroy
  public void close() {
    closed = true;
    topics.values().forEach(TopicLog::wakeAll);
  }

  private TopicLog topic(String name) {
    return topics.computeIfAbsent(name, TopicLog::new);
  }

  private final class TopicLog {

    private final String name;
    private final List<List<BrokerRecord>> partitions = new ArrayList<>();
    private final long[] baseOffsets = new long[partitionCount];
    private final Map<String, GroupState> groups = new HashMap<>();

    private TopicLog(String name) {
      this.name = name;
      for (int i = 0; i < partitionCount; i++) {
        partitions.add(new ArrayList<>());
      }
    }

    synchronized BrokerRecord append(String key, String payload) {
      int partition = Partitioner.partitionFor(key, partitionCount);
      var records = partitions.get(partition);
      long offset = baseOffsets[partition] + records.size();
      var record = new BrokerRecord(name, partition, offset, key, payload, clock.instant());
      records.add(record);
      notifyAll();
      return record;
    }

    synchronized Subscription join(String groupName) {
      var group = groups.computeIfAbsent(groupName, GroupState::new);
      var subscription = new Subscription(this, group);
      group.members.add(subscription);
      rebalance(group);
      log.debug(
          "Subscription joined topic={} group={} members={}",
          name,
          groupName,
          group.members.size());
      return subscription;
    }

    synchronized void leave(Subscription subscription) {
      if (subscription.closed) {
        return;
      }
      subscription.closed = true;
      subscription.group.members.remove(subscription);
      rebalance(subscription.group);
      notifyAll();
    }

    synchronized long committed(String groupName, int partition) {
      var group = groups.get(groupName);
      return group == null ? 0 : group.committed[partition];
    }

    synchronized long endOffset(int partition) {
      return baseOffsets[partition] + partitions.get(partition).size();
    }

    synchronized void wakeAll() {
      notifyAll();
    }

    private void rebalance(GroupState group) {
      int size = group.members.size();
      List<Set<Integer>> assignments = new ArrayList<>();
      for (int i = 0; i < size; i++) {
        assignments.add(new TreeSet<>());
      }
      for (int partition = 0; partition < partitionCount && size > 0; partition++) {
        assignments.get(partition % size).add(partition);
      }
      for (int i = 0; i < size; i++) {
        group.members.get(i).assign(assignments.get(i));
      }
    }

    synchronized List<BrokerRecord> poll(Subscription subscription, Duration timeout) {
      long deadline = System.nanoTime() + timeout.toNanos();
      while (true) {
        if (closed) {
          throw new BrokerUnavailableException("In-memory broker is shut down");
        }
        if (subscription.closed) {
          throw new IllegalStateException("Subscription is closed");
        }
        var batch = collect(subscription);
        if (!batch.isEmpty()) {
          return batch;
        }
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          return List.of();
        }
        try {
          TimeUnit.NANOSECONDS.timedWait(this, remaining);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return List.of();
        }
      }
    }

    private List<BrokerRecord> collect(Subscription subscription) {
      if (subscription.assigned.isEmpty()) {
        return List.of();
      }
      int perPartition = Math.max(1, maxPollRecords / subscription.assigned.size());
      List<BrokerRecord> batch = new ArrayList<>();
      for (int partition : subscription.assigned) {
        var records = partitions.get(partition);
        long base = baseOffsets[partition];
        long position = Math.max(subscription.positions[partition], base);
        long end = base + records.size();
        long stop = Math.min(end, position + perPartition);
        for (long offset = position; offset < stop; offset++) {
          batch.add(records.get((int) (offset - base)));
        }
        subscription.positions[partition] = stop;
      }
      return batch;
    }

    synchronized void commit(Subscription subscription, BrokerRecord record) {
      if (!subscription.assigned.contains(record.partition())) {
        log.debug(
            "Ignoring commit for unassigned partition topic={} group={} partition={}",
            name,
            subscription.group.name,
            record.partition());
        return;
      }
      long next = record.offset() + 1;
      long[] committed = subscription.group.committed;
      if (next > committed[record.partition()]) {
        committed[record.partition()] = next;
      }
    }

    synchronized void rewind(Subscription subscription, int partition) {
      if (subscription.assigned.contains(partition)) {
        subscription.positions[partition] =
            Math.max(subscription.group.committed[partition], baseOffsets[partition]);
      }
    }

    synchronized int prune(Instant cutoff) {
      int removed = 0;
      for (int partition = 0; partition < partitionCount; partition++) {
        var records = partitions.get(partition);
        int expired = 0;
        while (expired < records.size() && records.get(expired).timestamp().isBefore(cutoff)) {
          expired++;
        }
        if (expired > 0) {
          records.subList(0, expired).clear();
          baseOffsets[partition] += expired;
          removed += expired;
        }
      }
      return removed;
    }
  }

  private final class GroupState {

    private final String name;
    private final long[] committed = new long[partitionCount];
    private final List<Subscription> members = new ArrayList<>();

    private GroupState(String name) {
      this.name = name;
    }
  }

  private final class Subscription implements BrokerSubscription {

    private final TopicLog topicLog;
    private final GroupState group;
    private final long[] positions = new long[partitionCount];
    private Set<Integer> assigned = Set.of();
    private boolean closed;

    private Subscription(TopicLog topicLog, GroupState group) {
      this.topicLog = topicLog;
      this.group = group;
    }

    // caller holds the topic log monitor
    private void assign(Set<Integer> partitions) {
      for (int partition : partitions) {
        if (!assigned.contains(partition)) {
          positions[partition] = group.committed[partition];
        }
      }
      assigned = partitions;
    }

    @Override
    public List<BrokerRecord> poll(Duration timeout) {
      return topicLog.poll(this, timeout);
    }

    @Override
    public void commit(BrokerRecord record) {
      topicLog.commit(this, record);
    }

    @Override
    public void rewind(int partition) {
      topicLog.rewind(this, partition);
    }

    @Override
    public void close() {
      topicLog.leave(this);
    }
  }
}

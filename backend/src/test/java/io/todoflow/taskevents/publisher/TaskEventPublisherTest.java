package io.todoflow.taskevents.publisher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.todoflow.taskevents.MutableClock;
import io.todoflow.taskevents.broker.BrokerRecord;
import io.todoflow.taskevents.broker.BrokerSubscription;
import io.todoflow.taskevents.broker.BrokerUnavailableException;
import io.todoflow.taskevents.broker.EventBroker;
import io.todoflow.taskevents.config.BrokerProperties;
import io.todoflow.taskevents.config.PublisherProperties;
import io.todoflow.taskevents.event.TaskEventCodec;
import io.todoflow.taskevents.event.TestEvents;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TaskEventPublisherTest {

  private static final String EVENTS = "task-events";
  private static final String UPDATES = "task-updates";

  @Mock private EventBroker broker;

  private final MutableClock clock = new MutableClock(TestEvents.NOW);
  private final TaskEventCodec codec = new TaskEventCodec(new ObjectMapper());
  private TaskEventPublisher publisher;

  @BeforeEach
  void setUp() {
    publisher = publisherWithCapacity(100);
  }

  @Test
  void publish_sendsSamePayloadToBothTopicsKeyedByUser() {
    var event = TestEvents.created(TestEvents.task("user-1", "Buy milk"));

    var outcome = publisher.publish(event);

    assertThat(outcome).isEqualTo(PublishOutcome.PUBLISHED);
    String payload = codec.encode(event);
    verify(broker).publish(EVENTS, "user-1", payload);
    verify(broker).publish(UPDATES, "user-1", payload);
    assertThat(publisher.pendingCount()).isZero();
  }

  @Test
  void brokerFailure_queuesWithoutThrowing() {
    when(broker.publish(anyString(), anyString(), anyString()))
        .thenThrow(new BrokerUnavailableException("down"));

    var outcome = publisher.publish(TestEvents.created(TestEvents.task("user-1", "A")));

    assertThat(outcome).isEqualTo(PublishOutcome.QUEUED_FOR_RETRY);
    assertThat(publisher.pendingCount()).isEqualTo(2);
  }

  @Test
  void retryPending_waitsForBackoffThenPublishes() {
    var event = TestEvents.created(TestEvents.task("user-1", "A"));
    String payload = codec.encode(event);
    lenient()
        .doThrow(new BrokerUnavailableException("down"))
        .doReturn(record(EVENTS))
        .when(broker)
        .publish(EVENTS, "user-1", payload);
    publisher.publish(event);

    assertThat(publisher.retryPending()).isZero();

    clock.advance(Duration.ofMillis(100));
    assertThat(publisher.retryPending()).isEqualTo(1);
    assertThat(publisher.pendingCount()).isZero();
  }

  @Test
  void laterEventForSameKey_queuesBehindEarlierOne() {
    var first = TestEvents.created(TestEvents.task("user-1", "First"));
    var second = TestEvents.created(TestEvents.task("user-1", "Second"));
    String firstPayload = codec.encode(first);
    String secondPayload = codec.encode(second);
    lenient()
        .doThrow(new BrokerUnavailableException("down"))
        .doReturn(record(EVENTS))
        .when(broker)
        .publish(EVENTS, "user-1", firstPayload);

    publisher.publish(first);
    var outcome = publisher.publish(second);

    assertThat(outcome).isEqualTo(PublishOutcome.QUEUED_FOR_RETRY);
    verify(broker, times(0)).publish(EVENTS, "user-1", secondPayload);

    clock.advance(Duration.ofSeconds(1));
    assertThat(publisher.retryPending()).isEqualTo(2);
    var order = inOrder(broker);
    order.verify(broker, times(2)).publish(EVENTS, "user-1", firstPayload);
    order.verify(broker).publish(EVENTS, "user-1", secondPayload);
  }

  @Test
  void otherKeys_areNotBlockedByQueuedKey() {
    var blocked = TestEvents.created(TestEvents.task("user-1", "A"));
    var other = TestEvents.created(TestEvents.task("user-2", "B"));
    lenient()
        .doThrow(new BrokerUnavailableException("down"))
        .when(broker)
        .publish(eq(EVENTS), eq("user-1"), anyString());

    publisher.publish(blocked);

    assertThat(publisher.publish(other)).isEqualTo(PublishOutcome.PUBLISHED);
  }

  @Test
  void retryPending_dropsAfterMaxAttempts() {
    when(broker.publish(anyString(), anyString(), anyString()))
        .thenThrow(new BrokerUnavailableException("down"));
    publisher.publish(TestEvents.created(TestEvents.task("user-1", "A")));

    for (int i = 0; i < 5; i++) {
      clock.advance(Duration.ofMinutes(1));
      publisher.retryPending();
    }

    assertThat(publisher.pendingCount()).isZero();
  }

  @Test
  void fullQueue_rejects() {
    publisher = publisherWithCapacity(1);
    when(broker.publish(anyString(), anyString(), anyString()))
        .thenThrow(new BrokerUnavailableException("down"));

    var outcome = publisher.publish(TestEvents.created(TestEvents.task("user-1", "A")));

    assertThat(outcome).isEqualTo(PublishOutcome.REJECTED);
    assertThat(publisher.pendingCount()).isEqualTo(1);
  }

  @Test
  void retryPending_slowBrokerDoesNotHoldUpOtherPublishes() throws Exception {
    var slowBroker = new GatedBroker();
    var slowPublisher = publisher(slowBroker, 100);
    slowBroker.failing = true;
    slowPublisher.publish(TestEvents.created(TestEvents.task("user-1", "A")));
    slowBroker.failing = false;
    slowBroker.gatedKey = "user-1";
    clock.advance(Duration.ofSeconds(1));

    ExecutorService drainer = Executors.newSingleThreadExecutor();
    try {
      Future<Integer> drained = drainer.submit(slowPublisher::retryPending);
      assertThat(slowBroker.entered.await(5, TimeUnit.SECONDS)).isTrue();

      var otherUser =
          assertTimeoutPreemptively(
              Duration.ofSeconds(2),
              () -> slowPublisher.publish(TestEvents.created(TestEvents.task("user-2", "B"))));
      var sameUser =
          assertTimeoutPreemptively(
              Duration.ofSeconds(2),
              () -> slowPublisher.publish(TestEvents.created(TestEvents.task("user-1", "C"))));

      assertThat(otherUser).isEqualTo(PublishOutcome.PUBLISHED);
      assertThat(sameUser).isEqualTo(PublishOutcome.QUEUED_FOR_RETRY);

      slowBroker.release.countDown();
      assertThat(drained.get(5, TimeUnit.SECONDS)).isEqualTo(4);
      assertThat(slowPublisher.pendingCount()).isZero();
    } finally {
      slowBroker.release.countDown();
      drainer.shutdownNow();
    }
  }

  private TaskEventPublisher publisherWithCapacity(int capacity) {
    return publisher(broker, capacity);
  }

  private TaskEventPublisher publisher(EventBroker eventBroker, int capacity) {
    return new TaskEventPublisher(
        eventBroker,
        codec,
        new PublisherProperties(3, Duration.ofMillis(100), Duration.ofSeconds(1), capacity),
        new BrokerProperties(
            "in-memory", 4, Duration.ofDays(7), EVENTS, UPDATES, 100, Duration.ofSeconds(1)),
        clock);
  }

  private static BrokerRecord record(String topic) {
    return new BrokerRecord(topic, 0, 0, "user-1", "{}", TestEvents.NOW);
  }

  /** Broker whose sends for one key park until released. */
  private static final class GatedBroker implements EventBroker {

    private final CountDownLatch entered = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);
    private volatile boolean failing;
    private volatile String gatedKey;

    @Override
    public BrokerRecord publish(String topic, String key, String payload) {
      if (failing) {
        throw new BrokerUnavailableException("down");
      }
      if (key.equals(gatedKey)) {
        entered.countDown();
        try {
          if (!release.await(5, TimeUnit.SECONDS)) {
            throw new BrokerUnavailableException("send timed out");
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new BrokerUnavailableException("interrupted");
        }
      }
      return new BrokerRecord(topic, 0, 0, key, payload, TestEvents.NOW);
    }

    @Override
    public BrokerSubscription subscribe(String topic, String consumerGroup) {
      throw new UnsupportedOperationException();
    }
  }
}

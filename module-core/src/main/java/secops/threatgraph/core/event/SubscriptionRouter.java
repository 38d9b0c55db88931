package secops.threatgraph.core.event;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import secops.threatgraph.core.domain.model.ChangeEvent;

/**
 * 토픽 기반 구독 라우터
 *
 * <p>인덱스 세 개를 유지합니다.
 *
 * <ul>
 *   <li>topic → 구독 id 집합 (발행용 역참조, 소유하지 않음)
 *   <li>구독 id → 구독
 *   <li>connection → 구독 id 집합 (연결 종료 시 O(구독 수) 정리)
 * </ul>
 *
 * <p>인덱스 집합의 생성/추가와 빈 집합 제거는 모두 같은 키의 compute 안에서 일어납니다. 전역 락은 없습니다. 전달 순서는 구독 단위로만 보장되며, 재연결 시 놓친 이벤트를 다시 보내지 않습니다(at-most-once).
 */
@Slf4j
public class SubscriptionRouter {

  private final Map<String, Set<String>> topicIndex = new ConcurrentHashMap<>();
  private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> connectionIndex = new ConcurrentHashMap<>();

  private final SubscriptionAuthorizer authorizer;
  private final int queueCapacity;
  private final Executor notificationExecutor;
  private final Counter deliveredCounter;
  private final Counter droppedCounter;

  /**
   * @param notificationExecutor 구독 전달 리스너를 실행할 Executor. 발행 스레드가 리스너를 기다리지 않도록 별도 풀을 넘깁니다.
   */
  public SubscriptionRouter(
      SubscriptionAuthorizer authorizer,
      int queueCapacity,
      MeterRegistry meterRegistry,
      Executor notificationExecutor) {
    this.authorizer = authorizer;
    this.queueCapacity = queueCapacity;
    this.notificationExecutor = notificationExecutor;
    this.deliveredCounter = Counter.builder("subscription.event.delivered").register(meterRegistry);
    this.droppedCounter = Counter.builder("subscription.event.dropped").register(meterRegistry);
  }

  /**
   * @throws secops.threatgraph.error.exception.SubscriptionRejectedException 권한 부족
   */
  public Subscription subscribe(
      String topic, SubscriptionPredicate predicate, ConnectionRef connection) {
    authorizer.check(topic, connection.authContext());

    Subscription subscription =
        new Subscription(topic, predicate, connection, queueCapacity, notificationExecutor);
    subscriptions.put(subscription.getId(), subscription);
    addToIndex(connectionIndex, connection.connectionId(), subscription.getId());
    addToIndex(topicIndex, topic, subscription.getId());

    log.debug(
        "[SubscriptionRouter] Subscribed: topic={}, connection={}, id={}",
        topic,
        connection.connectionId(),
        subscription.getId());
    return subscription;
  }

  public boolean unsubscribe(Subscription subscription) {
    return unsubscribe(subscription.getId());
  }

  public boolean unsubscribe(String subscriptionId) {
    Subscription removed = subscriptions.remove(subscriptionId);
    if (removed == null) {
      return false;
    }
    removed.deactivate();
    removeFromIndex(topicIndex, removed.getTopic(), subscriptionId);
    removeFromIndex(connectionIndex, removed.getConnection().connectionId(), subscriptionId);
    return true;
  }

  /**
   * 연결이 소유한 모든 구독을 제거합니다.
   *
   * @return 제거된 구독 수
   */
  public int closeConnection(String connectionId) {
    Set<String> owned = connectionIndex.remove(connectionId);
    if (owned == null) {
      return 0;
    }
    int removed = 0;
    for (String subscriptionId : List.copyOf(owned)) {
      if (unsubscribe(subscriptionId)) {
        removed++;
      }
    }
    log.debug("[SubscriptionRouter] Connection closed: connection={}, removed={}", connectionId, removed);
    return removed;
  }

  /**
   * 토픽 구독자 중 조건이 맞는 구독 큐에 이벤트를 넣습니다.
   *
   * <p>조건 평가 중 예외는 불일치로 처리합니다. 큐 포화로 인한 유실은 발행자에게 알리지 않습니다.
   *
   * @return 큐에 들어간 구독 수
   */
  public int publish(String topic, ChangeEvent event) {
    Set<String> ids = topicIndex.get(topic);
    if (ids == null || ids.isEmpty()) {
      return 0;
    }
    int delivered = 0;
    for (String id : ids) {
      Subscription subscription = subscriptions.get(id);
      if (subscription == null || !evaluate(subscription, event)) {
        continue;
      }
      long droppedBefore = subscription.droppedCount();
      if (subscription.offer(event)) {
        delivered++;
      }
      long newlyDropped = subscription.droppedCount() - droppedBefore;
      if (newlyDropped > 0) {
        droppedCounter.increment(newlyDropped);
      }
    }
    deliveredCounter.increment(delivered);
    return delivered;
  }

  public int subscriberCount(String topic) {
    Set<String> ids = topicIndex.get(topic);
    return ids == null ? 0 : ids.size();
  }

  public int activeSubscriptionCount() {
    return subscriptions.size();
  }

  public int connectionCount() {
    return connectionIndex.size();
  }

  private boolean evaluate(Subscription subscription, ChangeEvent event) {
    try {
      return subscription.matches(event);
    } catch (RuntimeException e) {
      log.warn(
          "[SubscriptionRouter] Predicate failed, treated as non-match: subscription={}, cause={}",
          subscription.getId(),
          e.toString());
      return false;
    }
  }

  private static void addToIndex(Map<String, Set<String>> index, String key, String id) {
    index.compute(
        key,
        (k, ids) -> {
          Set<String> target = ids != null ? ids : ConcurrentHashMap.newKeySet();
          target.add(id);
          return target;
        });
  }

  private static void removeFromIndex(Map<String, Set<String>> index, String key, String id) {
    index.computeIfPresent(
        key,
        (k, ids) -> {
          ids.remove(id);
          return ids.isEmpty() ? null : ids;
        });
  }
}

package secops.threatgraph.core.event;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import secops.threatgraph.core.domain.model.ChangeEvent;

/**
 * 연결 하나가 소유하는 구독과 그 전용 FIFO 큐
 *
 * <p>큐 포화 시 가장 오래된 비CRITICAL 이벤트를 버리고 droppedCount를 올립니다. CRITICAL 이벤트는 버리지 않으며 용량을 넘겨서라도 넣습니다.
 * 큐에 CRITICAL만 남아 있으면 새로 들어온 비CRITICAL 이벤트를 버립니다.
 *
 * <p>구독마다 독립적으로 동기화하므로 느린 구독자가 다른 구독자의 전달을 막지 않습니다. 전달 리스너는 발행 스레드가 아닌 notifier
 * Executor에서 호출됩니다.
 */
@Slf4j
public class Subscription {

  @Getter private final String id;
  @Getter private final String topic;
  @Getter private final ConnectionRef connection;
  private final SubscriptionPredicate predicate;
  private final int capacity;
  private final Executor notifier;

  private final Deque<ChangeEvent> queue = new ArrayDeque<>();
  private long dropped;
  private volatile boolean active = true;
  private volatile Consumer<Subscription> deliveryListener;

  Subscription(
      String topic,
      SubscriptionPredicate predicate,
      ConnectionRef connection,
      int capacity,
      Executor notifier) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.id = UUID.randomUUID().toString();
    this.topic = topic;
    this.predicate = predicate;
    this.connection = connection;
    this.capacity = capacity;
    this.notifier = notifier;
  }

  boolean matches(ChangeEvent event) {
    return predicate.test(event, connection.authContext());
  }

  /**
   * @return 이벤트가 큐에 들어갔으면 true
   */
  boolean offer(ChangeEvent event) {
    boolean enqueued;
    synchronized (this) {
      if (!active) {
        return false;
      }
      enqueued = enqueue(event);
    }
    Consumer<Subscription> listener = deliveryListener;
    if (enqueued && listener != null) {
      wakeListener(listener);
    }
    return enqueued;
  }

  private void wakeListener(Consumer<Subscription> listener) {
    try {
      notifier.execute(() -> runListener(listener));
    } catch (RejectedExecutionException e) {
      log.warn(
          "[Subscription] Delivery notification rejected, event stays queued: id={}, cause={}",
          id,
          e.toString());
    }
  }

  private void runListener(Consumer<Subscription> listener) {
    try {
      listener.accept(this);
    } catch (RuntimeException e) {
      log.warn("[Subscription] Delivery listener failed: id={}, cause={}", id, e.toString());
    }
  }

  private boolean enqueue(ChangeEvent event) {
    if (queue.size() < capacity) {
      queue.addLast(event);
      return true;
    }
    if (dropOldestNonCritical()) {
      queue.addLast(event);
      return true;
    }
    if (event.isCritical()) {
      queue.addLast(event);
      return true;
    }
    dropped++;
    return false;
  }

  private boolean dropOldestNonCritical() {
    Iterator<ChangeEvent> it = queue.iterator();
    while (it.hasNext()) {
      if (!it.next().isCritical()) {
        it.remove();
        dropped++;
        return true;
      }
    }
    return false;
  }

  public synchronized Optional<ChangeEvent> poll() {
    return Optional.ofNullable(queue.pollFirst());
  }

  public synchronized List<ChangeEvent> drain(int max) {
    List<ChangeEvent> events = new ArrayList<>(Math.min(max, queue.size()));
    while (events.size() < max && !queue.isEmpty()) {
      events.add(queue.pollFirst());
    }
    return events;
  }

  /** 이 구독에서 버려진 이벤트 수. 발행자에게는 노출되지 않습니다. */
  public synchronized long droppedCount() {
    return dropped;
  }

  public synchronized int size() {
    return queue.size();
  }

  public int capacity() {
    return capacity;
  }

  public boolean isActive() {
    return active;
  }

  /** 이벤트가 큐에 들어간 뒤 notifier에서 호출됩니다. 전송 계층이 writer를 깨우는 용도입니다. */
  public void onDelivery(Consumer<Subscription> listener) {
    this.deliveryListener = listener;
  }

  synchronized void deactivate() {
    active = false;
    queue.clear();
  }
}

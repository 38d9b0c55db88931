package secops.threatgraph.core.loader;

import io.micrometer.core.instrument.Counter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import secops.threatgraph.error.exception.BatchFetchException;
import secops.threatgraph.global.executor.TaskContext;

/**
 * 요청 범위 중복 제거 배치 로더
 *
 * <p>{@link #load}는 키를 대기열에 넣고 Future만 돌려줍니다. 요청 루프가 작업 단위마다 {@link #dispatch()}를 한 번 호출하면 그동안 쌓인
 * 키를 중복 제거하여 maxBatchSize 단위로 배치 함수에 넘깁니다.
 *
 * <ul>
 *   <li>결과 순서는 키 순서와 같습니다.
 *   <li>한 번 해소된 키는 {@link #clear}/{@link #clearAll} 전까지 다시 fetch하지 않습니다.
 *   <li>배치 실패나 타임아웃은 해당 배치의 키만 fallback 값으로 해소하고, 다른 배치에는 영향을 주지 않습니다.
 *   <li>dispatch 이후의 취소는 없습니다. 요청자가 떠나도 배치는 끝까지 실행됩니다.
 * </ul>
 */
@Slf4j
public class BatchLoader<K, V> {

  private final String name;
  private final BatchFunction<K, V> batchFunction;
  private final LoaderOptions<V> options;
  private final LoaderSupport support;

  private final Map<K, CompletableFuture<V>> resolved = new HashMap<>();
  private final LinkedHashMap<K, CompletableFuture<V>> pending = new LinkedHashMap<>();

  private final AtomicLong dispatchCount = new AtomicLong();
  private final AtomicLong fetchedKeyCount = new AtomicLong();
  private final Counter dispatchCounter;
  private final Counter failureCounter;

  public BatchLoader(
      String name, BatchFunction<K, V> batchFunction, LoaderOptions<V> options, LoaderSupport support) {
    this.name = name;
    this.batchFunction = batchFunction;
    this.options = options;
    this.support = support;
    this.dispatchCounter =
        Counter.builder("loader.batch.dispatch").tag("loader", name).register(support.meterRegistry());
    this.failureCounter =
        Counter.builder("loader.batch.failure").tag("loader", name).register(support.meterRegistry());
  }

  public String getName() {
    return name;
  }

  public synchronized CompletableFuture<V> load(K key) {
    if (key == null) {
      throw new IllegalArgumentException("[" + name + "] key must not be null");
    }
    CompletableFuture<V> cached = options.cachingEnabled() ? resolved.get(key) : null;
    if (cached != null) {
      return cached;
    }
    CompletableFuture<V> queued = pending.get(key);
    if (queued != null) {
      return queued;
    }
    CompletableFuture<V> future = new CompletableFuture<>();
    pending.put(key, future);
    if (options.cachingEnabled()) {
      resolved.put(key, future);
    }
    return future;
  }

  /** 키 순서대로 값을 모은 Future */
  public CompletableFuture<List<V>> loadMany(Collection<K> keys) {
    List<CompletableFuture<V>> futures = keys.stream().map(this::load).toList();
    return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
        .thenApply(ignored -> futures.stream().map(CompletableFuture::join).toList());
  }

  /** 이미 값이 있는 키는 덮어쓰지 않습니다. 교체하려면 {@link #clear} 후 prime 합니다. */
  public synchronized BatchLoader<K, V> prime(K key, V value) {
    if (options.cachingEnabled() && !resolved.containsKey(key)) {
      resolved.put(key, CompletableFuture.completedFuture(value));
    }
    return this;
  }

  public synchronized BatchLoader<K, V> clear(K key) {
    resolved.remove(key);
    return this;
  }

  public synchronized BatchLoader<K, V> clearAll() {
    resolved.clear();
    return this;
  }

  public synchronized int pendingCount() {
    return pending.size();
  }

  public long getDispatchCount() {
    return dispatchCount.get();
  }

  public long getFetchedKeyCount() {
    return fetchedKeyCount.get();
  }

  /**
   * 대기 중인 키를 배치 함수로 보냅니다.
   *
   * @return 이번에 보낸 모든 배치가 해소되면 완료되는 Future (예외로 완료되지 않음)
   */
  public CompletableFuture<Void> dispatch() {
    List<K> keys;
    List<CompletableFuture<V>> futures;
    synchronized (this) {
      if (pending.isEmpty()) {
        return CompletableFuture.completedFuture(null);
      }
      keys = new ArrayList<>(pending.keySet());
      futures = new ArrayList<>(pending.values());
      pending.clear();
    }

    List<CompletableFuture<Void>> batches = new ArrayList<>();
    for (int from = 0; from < keys.size(); from += options.maxBatchSize()) {
      int to = Math.min(from + options.maxBatchSize(), keys.size());
      batches.add(dispatchBatch(keys.subList(from, to), futures.subList(from, to)));
    }
    return CompletableFuture.allOf(batches.toArray(CompletableFuture[]::new));
  }

  private CompletableFuture<Void> dispatchBatch(List<K> keys, List<CompletableFuture<V>> futures) {
    dispatchCount.incrementAndGet();
    fetchedKeyCount.addAndGet(keys.size());
    dispatchCounter.increment();

    CompletableFuture<List<V>> call;
    try {
      call = CompletableFuture.supplyAsync(() -> invoke(keys), support.fetchExecutor());
    } catch (RejectedExecutionException e) {
      // 풀 포화/종료 시 배치 전체를 fallback으로 해소
      resolveAll(futures, fallback(keys, e));
      return CompletableFuture.completedFuture(null);
    }
    if (options.fetchTimeout() != null) {
      call = call.orTimeout(options.fetchTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }
    return call.handle(
        (values, error) -> {
          if (error != null) {
            resolveAll(futures, fallback(keys, error));
          } else {
            resolveAll(futures, values);
          }
          return null;
        });
  }

  private List<V> invoke(List<K> keys) {
    return support
        .logicExecutor()
        .executeOrCatch(
            () -> checked(keys, batchFunction.fetch(List.copyOf(keys))),
            e -> fallback(keys, e),
            TaskContext.of("BatchLoader", "fetch", name));
  }

  private List<V> checked(List<K> keys, List<V> values) {
    if (values == null || values.size() != keys.size()) {
      throw new BatchFetchException(
          name, "size mismatch: expected=" + keys.size() + ", actual=" + (values == null ? "null" : values.size()));
    }
    return values;
  }

  private List<V> fallback(List<K> keys, Throwable cause) {
    failureCounter.increment();
    BatchFetchException failure = new BatchFetchException(name, keys, cause);
    log.warn("[BatchLoader] {} Resolving keys with fallback: cause={}", failure.getMessage(), cause.toString());
    List<V> values = new ArrayList<>(keys.size());
    for (int i = 0; i < keys.size(); i++) {
      values.add(options.fallback().get());
    }
    return values;
  }

  private void resolveAll(List<CompletableFuture<V>> futures, List<V> values) {
    for (int i = 0; i < futures.size(); i++) {
      V value = values.get(i);
      futures.get(i).complete(value != null ? value : options.fallback().get());
    }
  }
}

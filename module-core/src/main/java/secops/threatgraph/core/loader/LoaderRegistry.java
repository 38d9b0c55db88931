package secops.threatgraph.core.loader;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

/**
 * 요청 범위 로더 묶음
 *
 * <p>{@link #dispatchAll()}은 해소된 값에서 이어지는 load 호출까지 처리하도록 대기 키가 없어질 때까지 라운드를 반복합니다.
 */
@Slf4j
public class LoaderRegistry {

  static final int MAX_DISPATCH_ROUNDS = 64;

  private final LoaderSupport support;
  private final Map<String, BatchLoader<?, ?>> loaders = new LinkedHashMap<>();

  public LoaderRegistry(LoaderSupport support) {
    this.support = support;
  }

  public synchronized <K, V> BatchLoader<K, V> register(
      String name, BatchFunction<K, V> batchFunction, LoaderOptions<V> options) {
    if (loaders.containsKey(name)) {
      throw new IllegalStateException("Loader already registered: " + name);
    }
    BatchLoader<K, V> loader = new BatchLoader<>(name, batchFunction, options, support);
    loaders.put(name, loader);
    return loader;
  }

  @SuppressWarnings("unchecked")
  public synchronized <K, V> BatchLoader<K, V> get(String name) {
    BatchLoader<?, ?> loader = loaders.get(name);
    if (loader == null) {
      throw new IllegalArgumentException("Unknown loader: " + name);
    }
    return (BatchLoader<K, V>) loader;
  }

  public synchronized Collection<String> names() {
    return List.copyOf(loaders.keySet());
  }

  /**
   * 대기 키가 없을 때까지 모든 로더를 dispatch 합니다.
   *
   * @return 수행한 라운드 수
   */
  public int dispatchAll() {
    int rounds = 0;
    while (hasPending()) {
      if (rounds == MAX_DISPATCH_ROUNDS) {
        log.warn("[LoaderRegistry] Dispatch rounds exhausted, pending keys left: rounds={}", rounds);
        break;
      }
      List<CompletableFuture<Void>> inFlight = new ArrayList<>();
      for (BatchLoader<?, ?> loader : snapshot()) {
        inFlight.add(loader.dispatch());
      }
      CompletableFuture.allOf(inFlight.toArray(CompletableFuture[]::new)).join();
      rounds++;
    }
    return rounds;
  }

  public void clearAll() {
    snapshot().forEach(BatchLoader::clearAll);
  }

  public boolean hasPending() {
    return snapshot().stream().anyMatch(loader -> loader.pendingCount() > 0);
  }

  public long getDispatchCount() {
    return snapshot().stream().mapToLong(BatchLoader::getDispatchCount).sum();
  }

  public long getFetchedKeyCount() {
    return snapshot().stream().mapToLong(BatchLoader::getFetchedKeyCount).sum();
  }

  private synchronized List<BatchLoader<?, ?>> snapshot() {
    return new ArrayList<>(loaders.values());
  }
}

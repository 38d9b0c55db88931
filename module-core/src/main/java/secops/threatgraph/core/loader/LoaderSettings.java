package secops.threatgraph.core.loader;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * @param maxBatchSizes 종류별 최대 배치 크기 재정의 (없으면 {@link LoaderKind} 기본값)
 * @param fetchTimeout 배치 함수 타임아웃, null이면 무제한
 */
public record LoaderSettings(Map<LoaderKind, Integer> maxBatchSizes, Duration fetchTimeout) {

  public LoaderSettings {
    maxBatchSizes =
        maxBatchSizes == null || maxBatchSizes.isEmpty()
            ? Map.of()
            : Map.copyOf(new EnumMap<>(maxBatchSizes));
  }

  public static LoaderSettings defaults() {
    return new LoaderSettings(Map.of(), null);
  }

  public int maxBatchSize(LoaderKind kind) {
    return maxBatchSizes.getOrDefault(kind, kind.defaultMaxBatchSize());
  }

  public <V> LoaderOptions<V> options(LoaderKind kind, Supplier<V> fallback) {
    return new LoaderOptions<>(maxBatchSize(kind), true, fetchTimeout, fallback);
  }
}

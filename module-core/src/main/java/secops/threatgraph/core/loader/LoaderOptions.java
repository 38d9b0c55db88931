package secops.threatgraph.core.loader;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * @param maxBatchSize 한 번의 fetch 호출에 넘길 최대 키 수
 * @param cachingEnabled 요청 범위 키 캐시 사용 여부
 * @param fetchTimeout null이면 무제한. 초과 시 해당 배치의 키는 fallback 값으로 해소
 * @param fallback 실패/타임아웃 키에 줄 값 (엔티티 null, 관계 빈 목록, 카운트 0)
 */
public record LoaderOptions<V>(
    int maxBatchSize, boolean cachingEnabled, Duration fetchTimeout, Supplier<V> fallback) {

  public LoaderOptions {
    if (maxBatchSize < 1) {
      throw new IllegalArgumentException("maxBatchSize must be positive: " + maxBatchSize);
    }
    fallback = fallback == null ? () -> null : fallback;
  }

  public static <V> LoaderOptions<V> of(int maxBatchSize, Duration fetchTimeout, Supplier<V> fallback) {
    return new LoaderOptions<>(maxBatchSize, true, fetchTimeout, fallback);
  }

  public static <V> LoaderOptions<V> forKind(LoaderKind kind, Supplier<V> fallback) {
    return new LoaderOptions<>(kind.defaultMaxBatchSize(), true, null, fallback);
  }
}

package secops.threatgraph.infrastructure.ratelimit;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import secops.threatgraph.core.domain.model.OperationClass;

/**
 * @param failOpen 저장소 장애 시 허용(true) 또는 거부(false)
 * @param keyPrefix 버킷 키 접두사 (Cluster Hash Tag 포함, 예: {ratelimit})
 * @param limits 작업 분류별 한도. 없는 분류는 제한하지 않습니다.
 */
public record RateLimitPolicy(
    boolean failOpen, String keyPrefix, Map<OperationClass, BucketLimit> limits) {

  /** 분당 요청 100/20/5/10개와 분당 비용 10 000점 */
  public static RateLimitPolicy defaults() {
    Map<OperationClass, BucketLimit> limits = new EnumMap<>(OperationClass.class);
    Duration minute = Duration.ofMinutes(1);
    limits.put(OperationClass.STANDARD_QUERY, BucketLimit.perWindow(100, minute));
    limits.put(OperationClass.ENRICHMENT, BucketLimit.perWindow(20, minute));
    limits.put(OperationClass.BULK_IMPORT, BucketLimit.perWindow(5, minute));
    limits.put(OperationClass.SUBSCRIPTION_OPEN, BucketLimit.perWindow(10, minute));
    limits.put(OperationClass.QUERY_COMPLEXITY, BucketLimit.perWindow(10_000, minute));
    return new RateLimitPolicy(true, "{ratelimit}", limits);
  }

  public Optional<BucketLimit> limitFor(OperationClass operationClass) {
    return Optional.ofNullable(limits.get(operationClass));
  }

  /**
   * 프로세스 내 버킷의 유휴 만료 시간. 가장 느리게 차는 버킷의 충전 시간에 grace를 더합니다.
   */
  public Duration localBucketIdleExpiry(Duration grace) {
    return limits.values().stream()
        .map(BucketLimit::timeToFull)
        .max(Duration::compareTo)
        .orElse(Duration.ZERO)
        .plus(grace);
  }
}

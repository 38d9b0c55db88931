package secops.threatgraph.infrastructure.ratelimit;

import io.github.bucket4j.Bandwidth;
import java.time.Duration;

/**
 * 작업 분류 하나의 버킷 한도
 *
 * @param capacity 최대 토큰 수
 * @param refillTokens 리필 주기당 토큰 수
 * @param refillPeriod 리필 주기
 * @param greedy true면 주기 동안 균등 리필, false면 주기가 끝날 때 한 번에 리필 (고정 창)
 */
public record BucketLimit(long capacity, long refillTokens, Duration refillPeriod, boolean greedy) {

  /** 창마다 capacity만큼 한 번에 채우는 고정 창 한도 */
  public static BucketLimit perWindow(long capacity, Duration window) {
    return new BucketLimit(capacity, capacity, window, false);
  }

  /** 빈 버킷이 capacity까지 다시 차는 데 걸리는 시간 */
  public Duration timeToFull() {
    long periods = (capacity + refillTokens - 1) / refillTokens;
    return refillPeriod.multipliedBy(periods);
  }

  Bandwidth toBandwidth() {
    if (greedy) {
      return Bandwidth.builder().capacity(capacity).refillGreedy(refillTokens, refillPeriod).build();
    }
    return Bandwidth.builder()
        .capacity(capacity)
        .refillIntervally(refillTokens, refillPeriod)
        .build();
  }
}

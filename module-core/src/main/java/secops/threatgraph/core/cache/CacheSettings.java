package secops.threatgraph.core.cache;

import java.time.Duration;
import java.util.Map;

/**
 * EntityCacheManager 설정
 *
 * @param instanceId L1 무효화 이벤트 자기 수신 판별용
 * @param l1Enabled near-cache 사용 여부
 * @param l1MaxSize L1 최대 엔트리 수
 * @param l1MaxTtl L1 TTL 상한 (L2 TTL보다 짧게 유지)
 * @param ttlOverrides 키 접두사별 TTL 재정의
 * @param tagTtl 태그 인덱스 집합 TTL
 */
public record CacheSettings(
    String instanceId,
    boolean l1Enabled,
    long l1MaxSize,
    Duration l1MaxTtl,
    Map<String, Duration> ttlOverrides,
    Duration tagTtl) {

  public CacheSettings {
    ttlOverrides = ttlOverrides == null ? Map.of() : Map.copyOf(ttlOverrides);
  }

  public static CacheSettings defaults(String instanceId) {
    return new CacheSettings(
        instanceId, true, 10_000, Duration.ofMinutes(1), Map.of(), Duration.ofHours(24));
  }

  /** 접두사별 TTL: 재정의 → CacheType 기본값 → 1시간 */
  public Duration ttlFor(String prefix) {
    Duration override = ttlOverrides.get(prefix);
    if (override != null) {
      return override;
    }
    return CacheType.fromPrefix(prefix).map(CacheType::getTtl).orElse(CacheType.DEFAULT_TTL);
  }
}

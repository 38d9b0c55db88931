package secops.threatgraph.core.port.out;

import java.util.List;

/**
 * 다른 인스턴스의 L1 near-cache를 무효화하기 위한 이벤트
 *
 * @param sourceInstanceId 발행 인스턴스 (자기 자신 이벤트는 수신 측에서 무시)
 * @param targets EVICT이면 키 목록, EVICT_PATTERN이면 패턴 목록
 */
public record CacheInvalidationEvent(
    String sourceInstanceId, InvalidationType type, List<String> targets, long timestamp) {

  public CacheInvalidationEvent {
    targets = targets == null ? List.of() : List.copyOf(targets);
  }

  public static CacheInvalidationEvent evict(String instanceId, List<String> keys) {
    return new CacheInvalidationEvent(
        instanceId, InvalidationType.EVICT, keys, System.currentTimeMillis());
  }

  public static CacheInvalidationEvent evictPattern(String instanceId, List<String> patterns) {
    return new CacheInvalidationEvent(
        instanceId, InvalidationType.EVICT_PATTERN, patterns, System.currentTimeMillis());
  }

  public static CacheInvalidationEvent clearAll(String instanceId) {
    return new CacheInvalidationEvent(
        instanceId, InvalidationType.CLEAR_ALL, List.of(), System.currentTimeMillis());
  }
}

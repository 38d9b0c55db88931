package secops.threatgraph.core.port.out;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 여러 인스턴스가 공유하는 네트워크 key/value 저장소 포트
 *
 * <p>패턴 스캔과 원자적 카운터를 제공하는 저장소라면 구현할 수 있습니다. 구현체는 실패 시 런타임 예외를 던지고, 장애 흡수는 호출자(캐시 매니저)가
 * 담당합니다. 패턴은 Redis glob 문법({@code * ? [..]})을 따릅니다.
 */
public interface SharedCacheStore {

  /** 만료가 설정되지 않은 키의 남은 수명 */
  Duration NO_EXPIRY = Duration.ofMillis(Long.MAX_VALUE);

  Optional<String> get(String key);

  /**
   * 남은 수명 조회 (PTTL)
   *
   * @return 키가 없으면 empty, 만료가 없는 키는 {@link #NO_EXPIRY}
   */
  Optional<Duration> remainingTtl(String key);

  /** 존재하는 키만 담은 맵을 반환합니다. */
  Map<String, String> mget(Collection<String> keys);

  void set(String key, String value, Duration ttl);

  /** 한 번의 파이프라인 왕복으로 저장합니다. */
  default void mset(Map<String, String> entries, Duration ttl) {
    if (entries.isEmpty()) {
      return;
    }
    StorePipeline pipeline = pipeline();
    entries.forEach((key, value) -> pipeline.set(key, value, ttl));
    pipeline.execute();
  }

  long delete(Collection<String> keys);

  Set<String> keys(String pattern);

  default long deleteByPattern(String pattern) {
    Set<String> matched = keys(pattern);
    return matched.isEmpty() ? 0 : delete(matched);
  }

  /**
   * 원자적 증감. 키가 새로 만들어진 경우에만 ttlIfNew를 적용합니다.
   *
   * @return 증감 후 값
   */
  long incr(String key, long delta, Duration ttlIfNew);

  void addToSet(String key, Collection<String> members, Duration ttl);

  Set<String> members(String key);

  StorePipeline pipeline();

  boolean ping();

  /** 명령을 모아 한 번에 전송하는 파이프라인. execute 이전에는 아무 것도 반영되지 않습니다. */
  interface StorePipeline {

    StorePipeline set(String key, String value, Duration ttl);

    StorePipeline delete(String key);

    StorePipeline addToSet(String key, String member, Duration ttl);

    void execute();
  }

  /** 순서를 보존하는 mget 결과 병합 도우미 */
  static Map<String, String> orderedSubset(Collection<String> keys, Map<String, String> found) {
    Map<String, String> ordered = new LinkedHashMap<>();
    for (String key : keys) {
      String value = found.get(key);
      if (value != null) {
        ordered.put(key, value);
      }
    }
    return ordered;
  }
}

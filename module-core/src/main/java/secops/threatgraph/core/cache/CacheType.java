package secops.threatgraph.core.cache;

import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 캐시 키 접두사와 기본 TTL 정의
 *
 * <p>derived 유형은 주 엔티티에서 계산되는 캐시로, 주 엔티티의 연쇄 무효화 규칙으로 반드시 도달 가능해야 합니다.
 */
public enum CacheType {
  THREAT("threat", Duration.ofHours(1), false),
  IOC("ioc", Duration.ofMinutes(30), false),
  ACTOR("actor", Duration.ofHours(2), false),
  CAMPAIGN("campaign", Duration.ofHours(2), false),
  FEED("feed", Duration.ofMinutes(5), false),

  /** 외부 보강 결과 (호출 비용이 커서 24시간) */
  ENRICHMENT("enrichment", Duration.ofHours(24), true),
  ANALYTICS("analytics", Duration.ofMinutes(15), true),
  SEARCH("search", Duration.ofMinutes(5), true),
  CORRELATION("correlation", Duration.ofMinutes(10), true),
  ATTRIBUTION("attribution", Duration.ofHours(1), true),
  RELATIONSHIP("rel", Duration.ofMinutes(30), true),
  DASHBOARD("dashboard", Duration.ofMinutes(5), true);

  public static final Duration DEFAULT_TTL = Duration.ofHours(1);

  private static final Map<String, CacheType> BY_PREFIX =
      Arrays.stream(values()).collect(Collectors.toMap(CacheType::getPrefix, Function.identity()));

  private final String prefix;
  private final Duration ttl;
  private final boolean derived;

  CacheType(String prefix, Duration ttl, boolean derived) {
    this.prefix = Objects.requireNonNull(prefix);
    this.ttl = Objects.requireNonNull(ttl);
    this.derived = derived;
  }

  public String getPrefix() {
    return prefix;
  }

  public Duration getTtl() {
    return ttl;
  }

  public boolean isDerived() {
    return derived;
  }

  public static Optional<CacheType> fromPrefix(String prefix) {
    return Optional.ofNullable(BY_PREFIX.get(prefix));
  }

  @Override
  public String toString() {
    return prefix;
  }
}

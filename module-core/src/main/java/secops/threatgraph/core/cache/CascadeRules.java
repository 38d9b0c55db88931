package secops.threatgraph.core.cache;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 주 엔티티 유형별 연쇄 무효화 패턴 목록
 *
 * <p>패턴의 {@code {id}}는 무효화 대상 id로, {@code {org}}는 조직 id로 치환됩니다. 모든 주 유형이 같은 방식(패턴 삭제)을 쓰며, 태그
 * 무효화는 별도 API로만 제공합니다.
 */
public final class CascadeRules {

  private final Map<String, List<String>> patternsByType;

  private CascadeRules(Map<String, List<String>> patternsByType) {
    this.patternsByType = Collections.unmodifiableMap(patternsByType);
  }

  /**
   * 위협 인텔리전스 도메인 기본 규칙
   *
   * <p>관계 목록은 부모 쪽 키({@code rel:threat:{id}:*})와 자식 쪽 키({@code rel:*:threats})를 모두 지웁니다.
   */
  public static CascadeRules defaults() {
    return builder()
        .rule(
            "threat",
            "rel:threat:{id}:*",
            "rel:*:threats",
            "attribution:{id}",
            "correlation:*",
            "analytics:*",
            "search:*",
            "dashboard:*")
        .rule(
            "ioc",
            "enrichment:{id}:*",
            "rel:ioc:{id}:*",
            "rel:*:iocs",
            "correlation:*",
            "analytics:*",
            "search:*")
        .rule(
            "actor",
            "rel:actor:{id}:*",
            "rel:*:actors",
            "attribution:*",
            "analytics:*",
            "search:*")
        .rule("campaign", "rel:campaign:{id}:*", "rel:*:campaigns", "analytics:*", "search:*")
        .rule("feed", "rel:feed:{id}:*", "analytics:*", "dashboard:*")
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<String> patternsFor(String entityType, String id) {
    return patternsByType.getOrDefault(entityType, List.of()).stream()
        .map(template -> template.replace("{id}", id))
        .toList();
  }

  public Set<String> primaryTypes() {
    return patternsByType.keySet();
  }

  /** 치환 전 원본 패턴 전체 */
  public Map<String, List<String>> templates() {
    return patternsByType;
  }

  /** 조직 단위 무효화 패턴 (분석, 대시보드, 검색) */
  public static List<String> organizationPatterns(String organizationId) {
    return List.of(
        CacheType.ANALYTICS.getPrefix() + ":" + organizationId + ":*",
        CacheType.DASHBOARD.getPrefix() + ":" + organizationId + ":*",
        CacheType.SEARCH.getPrefix() + ":*");
  }

  public static final class Builder {
    private final Map<String, List<String>> rules = new LinkedHashMap<>();

    public Builder rule(String entityType, String... patterns) {
      rules.put(entityType, List.of(patterns));
      return this;
    }

    public CascadeRules build() {
      return new CascadeRules(new LinkedHashMap<>(rules));
    }
  }
}

package secops.threatgraph.core.cache;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * 모든 파생 캐시 유형이 하나 이상의 연쇄 규칙으로 도달 가능한지 검사합니다.
 *
 * <p>규칙 목록은 수작업으로 관리되므로 새 파생 유형을 추가하고 규칙을 빠뜨리면 기동 시점에 드러나도록 합니다.
 */
@Slf4j
public final class CascadeCoverageVerifier {

  public enum Mode {
    WARN,
    FAIL
  }

  /**
   * @return 어떤 규칙으로도 지워지지 않는 파생 유형 목록
   */
  public static List<CacheType> uncovered(CascadeRules rules) {
    Set<CacheType> covered = EnumSet.noneOf(CacheType.class);
    for (List<String> patterns : rules.templates().values()) {
      for (String pattern : patterns) {
        for (CacheType type : CacheType.values()) {
          if (reaches(pattern, type)) {
            covered.add(type);
          }
        }
      }
    }
    List<CacheType> missing = new ArrayList<>();
    for (CacheType type : CacheType.values()) {
      if (type.isDerived() && !covered.contains(type)) {
        missing.add(type);
      }
    }
    return missing;
  }

  public static void verify(CascadeRules rules, Mode mode) {
    List<CacheType> missing = uncovered(rules);
    if (missing.isEmpty()) {
      log.info("[CascadeCoverage] All derived cache types are reachable: rules={}", rules.primaryTypes());
      return;
    }
    if (mode == Mode.FAIL) {
      throw new IllegalStateException("Derived cache types without cascade rule: " + missing);
    }
    log.warn("[CascadeCoverage] Derived cache types without cascade rule: {}", missing);
  }

  private static boolean reaches(String pattern, CacheType type) {
    String probe = type.getPrefix() + ":";
    String head = pattern.contains("*") ? pattern.substring(0, pattern.indexOf('*')) : pattern;
    return probe.startsWith(head) || head.startsWith(probe);
  }

  private CascadeCoverageVerifier() {}
}

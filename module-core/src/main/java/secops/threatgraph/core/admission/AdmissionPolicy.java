package secops.threatgraph.core.admission;

import java.time.Duration;
import secops.threatgraph.core.domain.model.Role;

/**
 * 승인 정책 값
 *
 * @param costCeiling 비용 상한 (기본 2000)
 * @param maxDepth 최대 중첩 깊이 (기본 10)
 * @param defaultListSize 크기 인자가 없는 리스트 필드의 배수
 * @param roleScaling 역할별 상한 배수 적용 여부 (기본 꺼짐)
 * @param complexityBudgetEnabled 주체별 분당 비용 예산 차감 여부
 */
public record AdmissionPolicy(
    long costCeiling,
    int maxDepth,
    int defaultListSize,
    boolean roleScaling,
    boolean complexityBudgetEnabled) {

  static final Duration BASE_TIMEOUT = Duration.ofSeconds(30);
  static final Duration MAX_TIMEOUT = Duration.ofMinutes(5);
  static final long TIMEOUT_MILLIS_PER_POINT = 100;

  public static AdmissionPolicy defaults() {
    return new AdmissionPolicy(2000, 10, 10, false, true);
  }

  public long effectiveCeiling(Role role) {
    if (!roleScaling || role == null) {
      return costCeiling;
    }
    return (long) Math.floor(costCeiling * role.complexityMultiplier());
  }

  /** min(30초 + 점수 × 100ms, 5분) */
  public static Duration suggestedTimeout(long score) {
    long extra =
        score > (MAX_TIMEOUT.toMillis() / TIMEOUT_MILLIS_PER_POINT)
            ? MAX_TIMEOUT.toMillis()
            : score * TIMEOUT_MILLIS_PER_POINT;
    Duration timeout = BASE_TIMEOUT.plusMillis(extra);
    return timeout.compareTo(MAX_TIMEOUT) > 0 ? MAX_TIMEOUT : timeout;
  }
}

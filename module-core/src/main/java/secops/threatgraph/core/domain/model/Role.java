package secops.threatgraph.core.domain.model;

/**
 * 역할 등급
 *
 * <p>rank는 구독 권한 비교에, complexityMultiplier는 역할별 쿼리 복잡도 상한 조정에 사용합니다.
 */
public enum Role {
  VIEWER(0, 0.5),
  ANALYST(1, 1.0),
  INCIDENT_RESPONDER(2, 1.5),
  ADMIN(3, 2.0),
  SUPER_ADMIN(4, 3.0);

  private final int rank;
  private final double complexityMultiplier;

  Role(int rank, double complexityMultiplier) {
    this.rank = rank;
    this.complexityMultiplier = complexityMultiplier;
  }

  public boolean isAtLeast(Role required) {
    return rank >= required.rank;
  }

  public double complexityMultiplier() {
    return complexityMultiplier;
  }
}

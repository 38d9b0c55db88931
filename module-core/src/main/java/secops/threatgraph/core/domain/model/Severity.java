package secops.threatgraph.core.domain.model;

/** 위협 심각도. CRITICAL 이벤트는 구독 큐 포화 시에도 버려지지 않습니다. */
public enum Severity {
  LOW(0),
  MEDIUM(1),
  HIGH(2),
  CRITICAL(3);

  private final int level;

  Severity(int level) {
    this.level = level;
  }

  public int level() {
    return level;
  }

  public boolean isAtLeast(Severity other) {
    return level >= other.level;
  }
}

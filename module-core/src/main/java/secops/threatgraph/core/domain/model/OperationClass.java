package secops.threatgraph.core.domain.model;

/**
 * 토큰 버킷을 구분하는 작업 분류
 *
 * <p>QUERY_COMPLEXITY는 요청 수가 아닌 쿼리 비용 점수를 차감하는 예산 버킷입니다.
 */
public enum OperationClass {
  STANDARD_QUERY,
  ENRICHMENT,
  BULK_IMPORT,
  SUBSCRIPTION_OPEN,
  QUERY_COMPLEXITY;

  /** 설정 키 형식 (예: standard-query) */
  public String configKey() {
    return name().toLowerCase().replace('_', '-');
  }
}

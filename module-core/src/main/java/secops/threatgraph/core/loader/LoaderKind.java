package secops.threatgraph.core.loader;

/** 로더 종류별 기본 최대 배치 크기 */
public enum LoaderKind {
  ENTITY(100),
  RELATIONSHIP(50),
  /** 외부 보강 API 호출 */
  ENRICHMENT(20),
  /** 귀속 분석 등 고비용 계산 */
  ANALYSIS(10);

  private final int defaultMaxBatchSize;

  LoaderKind(int defaultMaxBatchSize) {
    this.defaultMaxBatchSize = defaultMaxBatchSize;
  }

  public int defaultMaxBatchSize() {
    return defaultMaxBatchSize;
  }
}

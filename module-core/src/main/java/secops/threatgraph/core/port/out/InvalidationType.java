package secops.threatgraph.core.port.out;

/** L1 무효화 이벤트 유형 */
public enum InvalidationType {
  /** 지정 키 제거 */
  EVICT,
  /** glob 패턴에 맞는 키 제거 */
  EVICT_PATTERN,
  /** L1 전체 제거 */
  CLEAR_ALL
}

package secops.threatgraph.core.domain.model;

/**
 * 요청 형태만으로 계산한 정적 비용. 저장하지 않는 파생 값입니다.
 *
 * @param score 필드 가중치 × 상위 리스트 배수의 합
 * @param depth 최대 중첩 깊이 (루트 필드 = 1)
 * @param fieldCount 방문한 필드 수
 */
public record CostEstimate(long score, int depth, int fieldCount) {}

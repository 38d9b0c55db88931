package secops.threatgraph.core.admission;

import java.time.Duration;
import secops.threatgraph.core.domain.model.CostEstimate;
import secops.threatgraph.core.port.out.ConsumeResult;

/**
 * 승인 결과. 거부는 예외로 표현하므로 이 값은 항상 허용입니다.
 *
 * @param estimate 비용 계산을 하지 않은 요청이면 점수 0
 * @param rateLimit 남은 토큰 정보, rate limit 비활성 시 null
 */
public record AdmissionDecision(
    CostEstimate estimate, long effectiveCeiling, Duration suggestedTimeout, ConsumeResult rateLimit) {}

package secops.threatgraph.core.admission;

import secops.threatgraph.core.domain.model.OperationClass;
import secops.threatgraph.core.port.out.ConsumeResult;
import secops.threatgraph.core.port.out.RateLimiter;
import secops.threatgraph.error.exception.RateLimitExceededException;

/**
 * 작업 분류별 요청 토큰 1개를 차감하고, 비용 예산이 켜져 있으면 쿼리 점수만큼 QUERY_COMPLEXITY 버킷을 차감합니다.
 */
public class RateLimitGate implements AdmissionGate {

  private final RateLimiter rateLimiter;
  private final AdmissionPolicy policy;

  public RateLimitGate(RateLimiter rateLimiter, AdmissionPolicy policy) {
    this.rateLimiter = rateLimiter;
    this.policy = policy;
  }

  @Override
  public String name() {
    return "rate";
  }

  @Override
  public void check(AdmissionContext context) {
    AdmissionRequest request = context.getRequest();
    ConsumeResult result = consume(request.operationClass(), request.principalKey(), 1);
    context.setRateLimit(result);

    long score = context.getEstimate().score();
    if (policy.complexityBudgetEnabled() && score > 0) {
      consume(OperationClass.QUERY_COMPLEXITY, request.principalKey(), score);
    }
  }

  private ConsumeResult consume(OperationClass operationClass, String principalKey, long tokens) {
    ConsumeResult result = rateLimiter.tryConsume(operationClass, principalKey, tokens);
    if (!result.allowed()) {
      throw new RateLimitExceededException(operationClass.name(), result.retryAfterSeconds());
    }
    return result;
  }
}

package secops.threatgraph.core.admission;

import lombok.extern.slf4j.Slf4j;
import secops.threatgraph.core.domain.model.CostEstimate;
import secops.threatgraph.error.exception.QueryDepthExceededException;
import secops.threatgraph.error.exception.QueryTooComplexException;

/** 깊이 → 비용 순서로 검사합니다. I/O가 없으므로 rate limit 게이트보다 먼저 둡니다. */
@Slf4j
public class QueryCostGate implements AdmissionGate {

  private final QueryCostAnalyzer analyzer;
  private final AdmissionPolicy policy;

  public QueryCostGate(QueryCostAnalyzer analyzer, AdmissionPolicy policy) {
    this.analyzer = analyzer;
    this.policy = policy;
  }

  @Override
  public String name() {
    return "cost";
  }

  @Override
  public void check(AdmissionContext context) {
    AdmissionRequest request = context.getRequest();
    long ceiling = policy.effectiveCeiling(request.auth().role());
    context.setEffectiveCeiling(ceiling);
    if (request.shape() == null) {
      return;
    }

    int depth = analyzer.depthOf(request.shape());
    if (depth > policy.maxDepth()) {
      throw new QueryDepthExceededException(depth, policy.maxDepth());
    }

    CostEstimate estimate = analyzer.estimate(request.shape());
    context.setEstimate(estimate);
    if (estimate.score() > ceiling) {
      log.info(
          "[QueryCostGate] Query too complex: score={}, ceiling={}, fields={}",
          estimate.score(),
          ceiling,
          estimate.fieldCount());
      throw new QueryTooComplexException(estimate.score(), ceiling);
    }
  }
}

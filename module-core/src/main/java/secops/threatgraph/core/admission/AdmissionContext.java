package secops.threatgraph.core.admission;

import lombok.Getter;
import lombok.Setter;
import secops.threatgraph.core.domain.model.CostEstimate;
import secops.threatgraph.core.port.out.ConsumeResult;

/** 게이트 사이에서 공유하는 요청 단위 상태 */
@Getter
@Setter
public class AdmissionContext {

  private final AdmissionRequest request;
  private CostEstimate estimate = new CostEstimate(0, 0, 0);
  private long effectiveCeiling;
  private ConsumeResult rateLimit;

  public AdmissionContext(AdmissionRequest request) {
    this.request = request;
  }
}

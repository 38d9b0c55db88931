package secops.threatgraph.core.admission;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import secops.threatgraph.error.exception.base.ClientBaseException;

/**
 * 실행 전 승인 제어
 *
 * <p>게이트를 등록 순서대로 실행하며 첫 거부에서 멈춥니다. 거부는 어떤 로더/캐시 작업보다 먼저 일어나므로 취소할 부분 작업이 없습니다.
 */
@Slf4j
public class AdmissionController {

  private final List<AdmissionGate> gates;
  private final Map<String, Counter> rejectionCounters = new LinkedHashMap<>();

  public AdmissionController(List<AdmissionGate> gates, MeterRegistry meterRegistry) {
    this.gates = List.copyOf(gates);
    for (AdmissionGate gate : this.gates) {
      rejectionCounters.put(
          gate.name(),
          Counter.builder("admission.rejected").tag("reason", gate.name()).register(meterRegistry));
    }
  }

  /**
   * @throws secops.threatgraph.error.exception.QueryDepthExceededException 깊이 초과
   * @throws secops.threatgraph.error.exception.QueryTooComplexException 비용 상한 초과
   * @throws secops.threatgraph.error.exception.RateLimitExceededException 토큰 소진
   */
  public AdmissionDecision admit(AdmissionRequest request) {
    AdmissionContext context = new AdmissionContext(request);
    for (AdmissionGate gate : gates) {
      try {
        gate.check(context);
      } catch (ClientBaseException rejection) {
        rejectionCounters.get(gate.name()).increment();
        log.debug(
            "[AdmissionController] Rejected: gate={}, operation={}, reason={}",
            gate.name(),
            request.operationClass(),
            rejection.getMessage());
        throw rejection;
      }
    }
    return new AdmissionDecision(
        context.getEstimate(),
        context.getEffectiveCeiling(),
        AdmissionPolicy.suggestedTimeout(context.getEstimate().score()),
        context.getRateLimit());
  }
}

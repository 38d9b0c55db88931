package secops.threatgraph.config;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import secops.threatgraph.core.admission.AdmissionController;
import secops.threatgraph.core.admission.AdmissionGate;
import secops.threatgraph.core.admission.AdmissionPolicy;
import secops.threatgraph.core.admission.FieldWeightTable;
import secops.threatgraph.core.admission.QueryCostAnalyzer;
import secops.threatgraph.core.admission.QueryCostGate;
import secops.threatgraph.core.admission.RateLimitGate;
import secops.threatgraph.core.port.out.OperationShapeParser;
import secops.threatgraph.core.port.out.RateLimiter;
import secops.threatgraph.infrastructure.graphql.GraphQLOperationShapeParser;

/**
 * 승인 제어 설정
 *
 * <p>게이트 순서는 비용(I/O 없음) → rate limit입니다. ratelimit.enabled=false면 RateLimiter 빈이 없으므로 비용 게이트만 둡니다.
 */
@Slf4j
@Configuration
public class AdmissionConfig {

  @Bean
  public AdmissionPolicy admissionPolicy(AdmissionProperties properties) {
    return properties.toPolicy();
  }

  @Bean
  public FieldWeightTable fieldWeightTable() {
    return FieldWeightTable.threatIntelDefaults();
  }

  @Bean
  public QueryCostAnalyzer queryCostAnalyzer(FieldWeightTable table, AdmissionPolicy policy) {
    return new QueryCostAnalyzer(table, policy.defaultListSize());
  }

  @Bean
  public OperationShapeParser operationShapeParser() {
    return new GraphQLOperationShapeParser();
  }

  @Bean
  public AdmissionController admissionController(
      QueryCostAnalyzer analyzer,
      AdmissionPolicy policy,
      ObjectProvider<RateLimiter> rateLimiter,
      MeterRegistry meterRegistry) {
    List<AdmissionGate> gates = new ArrayList<>();
    gates.add(new QueryCostGate(analyzer, policy));
    rateLimiter.ifAvailable(limiter -> gates.add(new RateLimitGate(limiter, policy)));
    log.info(
        "[AdmissionConfig] Gates: {}, costCeiling={}, maxDepth={}",
        gates.stream().map(AdmissionGate::name).toList(),
        policy.costCeiling(),
        policy.maxDepth());
    return new AdmissionController(gates, meterRegistry);
  }
}

package secops.threatgraph.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import secops.threatgraph.core.admission.AdmissionPolicy;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "threatgraph.admission")
public class AdmissionProperties {

  /** 정적 비용 상한 */
  @Min(1)
  private long costCeiling = 2000;

  @Min(1)
  private int maxDepth = 10;

  /** first/limit 인자가 없는 리스트 필드의 배수 */
  @Min(0)
  private int defaultListSize = 10;

  /** 역할별 상한 배수 (VIEWER 0.5 ~ SUPER_ADMIN 3.0) */
  private boolean roleScaling = false;

  /** 쿼리 점수를 QUERY_COMPLEXITY 버킷에서 차감할지 여부 */
  private boolean complexityBudgetEnabled = true;

  public AdmissionPolicy toPolicy() {
    return new AdmissionPolicy(
        costCeiling, maxDepth, defaultListSize, roleScaling, complexityBudgetEnabled);
  }
}

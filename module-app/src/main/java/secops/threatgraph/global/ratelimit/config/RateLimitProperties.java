package secops.threatgraph.global.ratelimit.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import secops.threatgraph.core.domain.model.OperationClass;
import secops.threatgraph.infrastructure.ratelimit.BucketLimit;
import secops.threatgraph.infrastructure.ratelimit.RateLimitPolicy;

/**
 * Rate Limiting 설정 프로퍼티
 *
 * <p>작업 분류별 버킷 한도. 설정하지 않은 분류는 기본 한도(분당 100/20/5/10, 비용 10 000점)를 씁니다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "ratelimit")
public class RateLimitProperties {

  /** 운영 중 긴급 비활성화용 */
  @NotNull private Boolean enabled = true;

  /**
   * 저장소 장애 시 동작
   *
   * <ul>
   *   <li>fail-open: 요청 허용 (가용성 우선)
   *   <li>fail-close: 60초 후 재시도로 거부 (보호 우선)
   * </ul>
   */
  @NotBlank private String failureMode = "fail-open";

  /** 버킷 키 접두사 (Redis Cluster Hash Tag 포함) */
  @NotBlank private String keyPrefix = "{ratelimit}";

  /** 분산 버킷이 마지막 쓰기 후 유지되는 최대 시간 */
  @NotNull private Duration bucketExpiration = Duration.ofMinutes(5);

  /** 작업 분류별 한도 (키: standard-query, enrichment, bulk-import, subscription-open, query-complexity) */
  @Valid @NotNull private Map<String, LimitConfig> operations = new LinkedHashMap<>();

  @Getter
  @Setter
  public static class LimitConfig {

    @Min(1)
    private long capacity;

    /** 생략하면 capacity */
    private Long refillTokens;

    @NotNull private Duration refillPeriod = Duration.ofMinutes(1);

    /** true면 균등 리필, false면 주기마다 한 번에 리필 */
    private boolean greedy = false;

    BucketLimit toBucketLimit() {
      return new BucketLimit(
          capacity, refillTokens != null ? refillTokens : capacity, refillPeriod, greedy);
    }
  }

  public boolean isFailOpen() {
    return "fail-open".equalsIgnoreCase(failureMode);
  }

  public RateLimitPolicy toPolicy() {
    Map<OperationClass, BucketLimit> limits =
        new EnumMap<>(RateLimitPolicy.defaults().limits());
    for (OperationClass operationClass : OperationClass.values()) {
      LimitConfig config = operations.get(operationClass.configKey());
      if (config != null) {
        limits.put(operationClass, config.toBucketLimit());
      }
    }
    return new RateLimitPolicy(isFailOpen(), keyPrefix, limits);
  }
}

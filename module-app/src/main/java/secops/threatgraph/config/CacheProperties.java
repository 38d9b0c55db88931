package secops.threatgraph.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import secops.threatgraph.core.cache.CacheSettings;
import secops.threatgraph.core.cache.CascadeCoverageVerifier;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "threatgraph.cache")
public class CacheProperties {

  /** L1(Caffeine) near-cache 사용 여부 */
  private boolean l1Enabled = true;

  @Min(0)
  private long l1MaxSize = 10_000;

  /**
   * L1 TTL 상한
   *
   * <p>무효화 이벤트를 놓친 인스턴스가 오래된 값을 들고 있을 수 있는 최대 시간입니다.
   */
  @NotNull private Duration l1MaxTtl = Duration.ofMinutes(1);

  /** 키 접두사별 TTL 재정의 (예: threat: 30m) */
  @NotNull private Map<String, Duration> ttl = new HashMap<>();

  @NotNull private Duration tagTtl = Duration.ofHours(24);

  /** 시작 시 cascade 규칙 검사 결과 처리 (warn | fail) */
  @NotNull private CascadeCoverageVerifier.Mode coverageCheck = CascadeCoverageVerifier.Mode.WARN;

  /** L1 무효화 브로드캐스트 채널 */
  @NotBlank private String invalidationChannel = "threatgraph:cache:invalidation";

  public CacheSettings toSettings(String instanceId) {
    return new CacheSettings(instanceId, l1Enabled, l1MaxSize, l1MaxTtl, ttl, tagTtl);
  }
}

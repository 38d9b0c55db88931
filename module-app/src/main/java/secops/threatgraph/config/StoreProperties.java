package secops.threatgraph.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 공유 저장소 설정
 *
 * <ul>
 *   <li>memory: 단일 인스턴스, 프로세스 내 캐시/버킷/이벤트
 *   <li>redis: Redisson 기반 공유 캐시, 분산 버킷, RTopic fan-out
 * </ul>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "threatgraph.store")
public class StoreProperties {

  @NotBlank
  @Pattern(regexp = "memory|redis")
  private String type = "memory";

  /** 공유 캐시 키 접두사 */
  @NotNull private String keyPrefix = "threatgraph:";

  @Valid @NotNull private Redis redis = new Redis();

  public boolean isRedis() {
    return "redis".equals(type);
  }

  @Getter
  @Setter
  public static class Redis {

    @NotBlank private String address = "redis://localhost:6379";

    private String password;

    @Min(0)
    private int database = 0;

    @NotNull private Duration timeout = Duration.ofSeconds(3);

    @NotNull private Duration connectTimeout = Duration.ofSeconds(5);

    @Min(1)
    private int connectionPoolSize = 64;

    @Min(1)
    private int connectionMinimumIdleSize = 24;
  }
}

package secops.threatgraph.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import secops.threatgraph.core.loader.LoaderKind;
import secops.threatgraph.core.loader.LoaderSettings;

/** BatchLoader 설정. batch-sizes에 없는 종류는 기본 크기를 씁니다. */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "threatgraph.loader")
public class LoaderProperties {

  @NotNull private Map<LoaderKind, Integer> batchSizes = new EnumMap<>(LoaderKind.class);

  /** 배치 함수 한 번의 최대 실행 시간 */
  @NotNull private Duration fetchTimeout = Duration.ofSeconds(10);

  /** 배치 함수를 실행할 스레드 수 */
  @Min(1)
  private int fetchThreads = 8;

  public LoaderSettings toSettings() {
    return new LoaderSettings(batchSizes, fetchTimeout);
  }
}

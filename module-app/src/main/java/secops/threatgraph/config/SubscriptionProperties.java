package secops.threatgraph.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import secops.threatgraph.core.domain.model.Role;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "threatgraph.subscription")
public class SubscriptionProperties {

  /** 구독별 큐 용량. 넘치면 가장 오래된 비CRITICAL 이벤트를 버립니다. */
  @Min(1)
  private int queueCapacity = 256;

  /** 전달 리스너 실행 스레드 수 */
  @Min(1)
  private int notifyThreads = 2;

  /** 전달 알림 대기 용량. 넘치면 알림만 버리고 이벤트는 큐에 남습니다. */
  @Min(1)
  private int notifyQueueCapacity = 10_000;

  /** 구독에 필요한 최소 역할 */
  @NotNull private Role requiredRole = Role.ANALYST;

  /** 인스턴스 간 변경 이벤트 채널 (redis 구성) */
  @NotBlank private String eventChannel = "threatgraph:events";
}

package secops.threatgraph.core.event;

import java.util.Objects;
import secops.threatgraph.core.domain.model.AuthContext;

/**
 * 지속 연결(웹소켓 등) 참조. 구독은 이 연결이 소유합니다.
 *
 * @param connectionId 전송 계층이 부여한 연결 식별자
 * @param authContext 연결 수립 시 인증된 호출자 정보
 */
public record ConnectionRef(String connectionId, AuthContext authContext) {

  public ConnectionRef {
    Objects.requireNonNull(connectionId, "connectionId");
    Objects.requireNonNull(authContext, "authContext");
  }
}

package secops.threatgraph.core.admission;

import java.util.Objects;
import secops.threatgraph.core.domain.model.AuthContext;
import secops.threatgraph.core.domain.model.OperationClass;

/**
 * @param shape 비용 계산 대상. 구독 개설처럼 형태가 없는 요청은 null
 */
public record AdmissionRequest(AuthContext auth, OperationClass operationClass, OperationShape shape) {

  public AdmissionRequest {
    Objects.requireNonNull(auth, "auth");
    Objects.requireNonNull(operationClass, "operationClass");
  }

  public String principalKey() {
    return auth.principalId();
  }
}

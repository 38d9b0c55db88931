package secops.threatgraph.service;

import java.util.Map;
import java.util.Objects;
import secops.threatgraph.core.domain.model.AuthContext;
import secops.threatgraph.core.domain.model.OperationClass;

/**
 * 파이프라인 입력
 *
 * @param document GraphQL 요청 문서. 비용 계산이 필요 없는 요청(구독 개설 등)은 null
 */
public record GraphRequest(
    AuthContext auth,
    OperationClass operationClass,
    String document,
    String operationName,
    Map<String, Object> variables) {

  public GraphRequest {
    Objects.requireNonNull(auth, "auth");
    Objects.requireNonNull(operationClass, "operationClass");
    variables = variables == null ? Map.of() : variables;
  }

  public static GraphRequest query(AuthContext auth, String document) {
    return new GraphRequest(auth, OperationClass.STANDARD_QUERY, document, null, Map.of());
  }
}

package secops.threatgraph.core.admission;

import java.util.List;

/**
 * 실행 전 요청 형태
 *
 * @param operationType query, mutation, subscription
 * @param selections 루트 필드 목록
 */
public record OperationShape(
    String operationName, OperationType operationType, List<FieldSelection> selections) {

  public enum OperationType {
    QUERY("Query"),
    MUTATION("Mutation"),
    SUBSCRIPTION("Subscription");

    private final String rootTypeName;

    OperationType(String rootTypeName) {
      this.rootTypeName = rootTypeName;
    }

    public String rootTypeName() {
      return rootTypeName;
    }
  }

  public OperationShape {
    selections = selections == null ? List.of() : List.copyOf(selections);
  }

  public static OperationShape query(FieldSelection... selections) {
    return new OperationShape(null, OperationType.QUERY, List.of(selections));
  }
}

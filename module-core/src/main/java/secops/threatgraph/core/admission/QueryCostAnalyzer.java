package secops.threatgraph.core.admission;

import java.util.List;
import secops.threatgraph.core.admission.FieldWeightTable.FieldWeight;
import secops.threatgraph.core.domain.model.CostEstimate;

/**
 * 요청 형태의 정적 비용 계산
 *
 * <p>{@code cost(field) = weight × 상위 리스트 배수 곱 + Σ cost(child)}. 리스트 필드의 배수는 크기 인자(first, limit) 값이며, 없으면
 * defaultListSize를 씁니다. 요청 형태만 보므로 저장소를 전혀 호출하지 않습니다.
 */
public class QueryCostAnalyzer {

  private static final String TYPENAME = "__typename";

  private final FieldWeightTable table;
  private final int defaultListSize;

  public QueryCostAnalyzer(FieldWeightTable table, int defaultListSize) {
    this.table = table;
    this.defaultListSize = defaultListSize;
  }

  public CostEstimate estimate(OperationShape shape) {
    Accumulator acc = new Accumulator();
    String root = shape.operationType().rootTypeName();
    for (FieldSelection selection : shape.selections()) {
      visit(selection, root, 1L, 1, acc);
    }
    return new CostEstimate(acc.score, acc.maxDepth, acc.fieldCount);
  }

  /** 깊이만 계산합니다. 깊이 제한은 비용 계산 전에 검사합니다. */
  public int depthOf(OperationShape shape) {
    int max = 0;
    for (FieldSelection selection : shape.selections()) {
      max = Math.max(max, depth(selection, 1));
    }
    return max;
  }

  private int depth(FieldSelection selection, int current) {
    int max = current;
    for (FieldSelection child : selection.children()) {
      max = Math.max(max, depth(child, current + 1));
    }
    return max;
  }

  private void visit(FieldSelection field, String parentType, long multiplier, int depth, Accumulator acc) {
    acc.fieldCount++;
    acc.maxDepth = Math.max(acc.maxDepth, depth);
    if (TYPENAME.equals(field.name())) {
      return;
    }
    String ownerType = field.typeCondition() != null ? field.typeCondition() : parentType;
    FieldWeight weight =
        table.lookup(ownerType, field.name())
            .orElseGet(() -> new FieldWeight(FieldWeightTable.SCALAR_WEIGHT, null, null));

    acc.score = saturatedAdd(acc.score, saturatedMultiply(weight.weight(), multiplier));

    long childMultiplier =
        weight.isList() ? saturatedMultiply(multiplier, listSize(field, weight)) : multiplier;
    String childType = weight.returnType() != null ? weight.returnType() : "";
    List<FieldSelection> children = field.children();
    for (FieldSelection child : children) {
      visit(child, childType, childMultiplier, depth + 1, acc);
    }
  }

  private long listSize(FieldSelection field, FieldWeight weight) {
    Object value = field.arguments().get(weight.sizeArgument());
    if (value instanceof Number number && number.longValue() >= 0) {
      return number.longValue();
    }
    return defaultListSize;
  }

  private static long saturatedMultiply(long a, long b) {
    long high = Math.multiplyHigh(a, b);
    long low = a * b;
    if ((high == 0 && low >= 0) || (high == -1 && low < 0)) {
      return low;
    }
    return Long.MAX_VALUE;
  }

  private static long saturatedAdd(long a, long b) {
    long sum = a + b;
    return ((a ^ sum) & (b ^ sum)) < 0 ? Long.MAX_VALUE : sum;
  }

  private static final class Accumulator {
    private long score;
    private int maxDepth;
    private int fieldCount;
  }
}

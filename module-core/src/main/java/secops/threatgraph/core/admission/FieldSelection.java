package secops.threatgraph.core.admission;

import java.util.List;
import java.util.Map;

/**
 * 요청된 필드 하나와 그 하위 선택
 *
 * @param name 스키마 필드명 (별칭 아님)
 * @param arguments 정수 리터럴 또는 변수로 해석된 인자
 * @param typeCondition 인라인 프래그먼트/프래그먼트 스프레드에서 온 경우 그 타입 조건, 없으면 null
 */
public record FieldSelection(
    String name, Map<String, Object> arguments, String typeCondition, List<FieldSelection> children) {

  public FieldSelection {
    arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    children = children == null ? List.of() : List.copyOf(children);
  }

  public static FieldSelection leaf(String name) {
    return new FieldSelection(name, Map.of(), null, List.of());
  }

  public static FieldSelection of(String name, FieldSelection... children) {
    return new FieldSelection(name, Map.of(), null, List.of(children));
  }

  public static FieldSelection of(
      String name, Map<String, Object> arguments, FieldSelection... children) {
    return new FieldSelection(name, arguments, null, List.of(children));
  }
}

package secops.threatgraph.infrastructure.graphql;

import graphql.language.Argument;
import graphql.language.Document;
import graphql.language.Field;
import graphql.language.FragmentDefinition;
import graphql.language.FragmentSpread;
import graphql.language.InlineFragment;
import graphql.language.IntValue;
import graphql.language.OperationDefinition;
import graphql.language.Selection;
import graphql.language.SelectionSet;
import graphql.language.Value;
import graphql.language.VariableReference;
import graphql.parser.InvalidSyntaxException;
import graphql.parser.Parser;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import secops.threatgraph.core.admission.FieldSelection;
import secops.threatgraph.core.admission.OperationShape;
import secops.threatgraph.core.admission.OperationShape.OperationType;
import secops.threatgraph.core.port.out.OperationShapeParser;
import secops.threatgraph.error.exception.InvalidInputException;

/**
 * graphql-java 파서로 요청 문서를 {@link OperationShape}로 바꿉니다.
 *
 * <p>스키마 없이 문법만 봅니다. 별칭은 스키마 필드명으로 되돌리고, 프래그먼트 스프레드와 인라인 프래그먼트는 부모 선택에 펼치되 타입 조건을
 * 남깁니다. 인자는 정수 리터럴과 정수 변수만 해석합니다.
 */
@Slf4j
public class GraphQLOperationShapeParser implements OperationShapeParser {

  private final Parser parser = new Parser();

  @Override
  public OperationShape parse(String document, String operationName, Map<String, Object> variables) {
    Document parsed = parseDocument(document);
    OperationDefinition operation = selectOperation(parsed, operationName);
    Map<String, FragmentDefinition> fragments =
        parsed.getDefinitionsOfType(FragmentDefinition.class).stream()
            .collect(Collectors.toMap(FragmentDefinition::getName, Function.identity(), (a, b) -> a));

    Context context =
        new Context(fragments, variables == null ? Map.of() : variables, new HashSet<>());
    List<FieldSelection> selections = collect(operation.getSelectionSet(), null, context);
    return new OperationShape(operation.getName(), typeOf(operation), selections);
  }

  private Document parseDocument(String document) {
    try {
      return parser.parseDocument(document);
    } catch (InvalidSyntaxException e) {
      log.debug("[OperationShapeParser] Invalid syntax: {}", e.getMessage());
      throw new InvalidInputException("document: " + e.getMessage());
    }
  }

  private static OperationDefinition selectOperation(Document document, String operationName) {
    List<OperationDefinition> operations = document.getDefinitionsOfType(OperationDefinition.class);
    if (operations.isEmpty()) {
      throw new InvalidInputException("document has no operation");
    }
    if (operationName == null || operationName.isBlank()) {
      if (operations.size() > 1) {
        throw new InvalidInputException("operationName required for multi-operation document");
      }
      return operations.get(0);
    }
    return operations.stream()
        .filter(op -> operationName.equals(op.getName()))
        .findFirst()
        .orElseThrow(() -> new InvalidInputException("unknown operation: " + operationName));
  }

  private static OperationType typeOf(OperationDefinition operation) {
    return switch (operation.getOperation()) {
      case MUTATION -> OperationType.MUTATION;
      case SUBSCRIPTION -> OperationType.SUBSCRIPTION;
      default -> OperationType.QUERY;
    };
  }

  private List<FieldSelection> collect(SelectionSet selectionSet, String typeCondition, Context context) {
    if (selectionSet == null) {
      return List.of();
    }
    List<FieldSelection> result = new ArrayList<>();
    for (Selection<?> selection : selectionSet.getSelections()) {
      if (selection instanceof Field field) {
        result.add(toFieldSelection(field, typeCondition, context));
      } else if (selection instanceof InlineFragment inline) {
        String condition =
            inline.getTypeCondition() != null ? inline.getTypeCondition().getName() : typeCondition;
        result.addAll(collect(inline.getSelectionSet(), condition, context));
      } else if (selection instanceof FragmentSpread spread) {
        result.addAll(expandSpread(spread, context));
      }
    }
    return result;
  }

  /** 같은 경로에서 다시 나타나는 스프레드(순환)는 펼치지 않습니다. */
  private List<FieldSelection> expandSpread(FragmentSpread spread, Context context) {
    FragmentDefinition fragment = context.fragments().get(spread.getName());
    if (fragment == null) {
      throw new InvalidInputException("unknown fragment: " + spread.getName());
    }
    if (!context.expanding().add(spread.getName())) {
      log.debug("[OperationShapeParser] Fragment cycle skipped: fragment={}", spread.getName());
      return List.of();
    }
    List<FieldSelection> expanded =
        collect(fragment.getSelectionSet(), fragment.getTypeCondition().getName(), context);
    context.expanding().remove(spread.getName());
    return expanded;
  }

  private FieldSelection toFieldSelection(Field field, String typeCondition, Context context) {
    Map<String, Object> arguments = new HashMap<>();
    for (Argument argument : field.getArguments()) {
      Object resolved = resolve(argument.getValue(), context.variables());
      if (resolved != null) {
        arguments.put(argument.getName(), resolved);
      }
    }
    List<FieldSelection> children = collect(field.getSelectionSet(), null, context);
    return new FieldSelection(field.getName(), arguments, typeCondition, children);
  }

  private static Object resolve(Value<?> value, Map<String, Object> variables) {
    if (value instanceof IntValue intValue) {
      return intValue.getValue().longValue();
    }
    if (value instanceof VariableReference reference) {
      Object bound = variables.get(reference.getName());
      return bound instanceof Number number ? number.longValue() : null;
    }
    return null;
  }

  private record Context(
      Map<String, FragmentDefinition> fragments,
      Map<String, Object> variables,
      Set<String> expanding) {}
}

package secops.threatgraph.core.port.out;

import java.util.Map;
import secops.threatgraph.core.admission.OperationShape;

/** 요청 문서를 실행 없이 선택 형태로 변환하는 포트 */
public interface OperationShapeParser {

  OperationShape parse(String document, String operationName, Map<String, Object> variables);
}

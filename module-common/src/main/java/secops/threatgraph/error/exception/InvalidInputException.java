package secops.threatgraph.error.exception;

import secops.threatgraph.error.CommonErrorCode;
import secops.threatgraph.error.exception.base.ClientBaseException;

/** 파싱할 수 없는 요청 문서나 존재하지 않는 operation 이름 */
public class InvalidInputException extends ClientBaseException {

  public InvalidInputException(String detail) {
    super(CommonErrorCode.INVALID_INPUT_VALUE, detail);
  }
}

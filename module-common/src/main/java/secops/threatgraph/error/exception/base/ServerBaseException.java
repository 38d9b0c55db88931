package secops.threatgraph.error.exception.base;

import secops.threatgraph.error.ErrorCode;

/**
 * ServerBaseException: 저장소 장애나 직렬화 실패 등 5xx 계열 예외. 장애 분석을 위해 원인(cause)을 함께 보존하는 것이 주 목적입니다.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  // 상세 메시지(args)와 실제 에러(cause)를 동시에 기록
  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}

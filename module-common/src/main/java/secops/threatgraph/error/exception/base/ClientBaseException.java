package secops.threatgraph.error.exception.base;

import secops.threatgraph.error.ErrorCode;

/**
 * ClientBaseException: 호출자가 요청을 조정하면 해결할 수 있는 4xx 계열 예외.
 *
 * <p>스택 트레이스보다 응답 메시지(점수, 상한, 재시도 시간)가 중요합니다.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}

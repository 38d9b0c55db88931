package secops.threatgraph.error.exception;

import secops.threatgraph.error.CommonErrorCode;
import secops.threatgraph.error.exception.base.ServerBaseException;

/**
 * LogicExecutor 전용 시스템 예외
 *
 * <p>관리되지 않은 예외(Checked 예외, 라이브러리 런타임 예외)를 프로젝트 규격에 맞게 래핑합니다. taskName으로 발생 지점을 추적합니다.
 */
public class InternalSystemException extends ServerBaseException {

  /**
   * @param taskName 작업 이름 (예: "CacheManager:mget:threat")
   * @param cause 원본 예외
   */
  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause, taskName);
  }

  public InternalSystemException(String taskName) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, taskName);
  }
}

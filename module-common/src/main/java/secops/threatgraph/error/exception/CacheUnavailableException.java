package secops.threatgraph.error.exception;

import secops.threatgraph.error.CommonErrorCode;
import secops.threatgraph.error.exception.base.ServerBaseException;

/**
 * 공유 캐시 저장소 접근 실패
 *
 * <p>캐시 매니저 내부에서만 발생하고 내부에서 흡수됩니다. 호출자는 백엔드 저장소로 폴백합니다.
 */
public class CacheUnavailableException extends ServerBaseException {

  public CacheUnavailableException(String operation, Throwable cause) {
    super(CommonErrorCode.CACHE_UNAVAILABLE, cause, operation);
  }
}

package secops.threatgraph.error.exception;

import lombok.Getter;
import secops.threatgraph.error.CommonErrorCode;
import secops.threatgraph.error.exception.base.ClientBaseException;

/**
 * 토큰 버킷 소진 시 발생하는 예외 (HTTP 429)
 *
 * <p>retryAfterSeconds는 Retry-After 헤더로 그대로 노출됩니다.
 */
@Getter
public class RateLimitExceededException extends ClientBaseException {

  private final String operationClass;
  private final long retryAfterSeconds;

  public RateLimitExceededException(String operationClass, long retryAfterSeconds) {
    super(CommonErrorCode.RATE_LIMIT_EXCEEDED, retryAfterSeconds);
    this.operationClass = operationClass;
    this.retryAfterSeconds = retryAfterSeconds;
  }
}

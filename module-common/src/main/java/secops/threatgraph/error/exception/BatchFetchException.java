package secops.threatgraph.error.exception;

import secops.threatgraph.error.CommonErrorCode;
import secops.threatgraph.error.exception.base.ServerBaseException;

/** 배치 조회 중 특정 키 집합의 실패. 로더가 로그로 남기고 해당 키만 폴백 값으로 해소합니다. */
public class BatchFetchException extends ServerBaseException {

  public BatchFetchException(String loaderName, Object keys, Throwable cause) {
    super(CommonErrorCode.BATCH_FETCH_FAILURE, cause, loaderName, keys);
  }

  public BatchFetchException(String loaderName, Object keys) {
    super(CommonErrorCode.BATCH_FETCH_FAILURE, loaderName, keys);
  }
}

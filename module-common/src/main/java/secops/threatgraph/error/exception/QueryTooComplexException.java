package secops.threatgraph.error.exception;

import lombok.Getter;
import secops.threatgraph.error.CommonErrorCode;
import secops.threatgraph.error.exception.base.ClientBaseException;

/** 정적 비용 점수가 상한을 넘은 쿼리. 점수와 상한을 함께 돌려주어 호출자가 선택 필드를 줄일 수 있게 합니다. */
@Getter
public class QueryTooComplexException extends ClientBaseException {

  private final long score;
  private final long ceiling;

  public QueryTooComplexException(long score, long ceiling) {
    super(CommonErrorCode.QUERY_TOO_COMPLEX, score, ceiling);
    this.score = score;
    this.ceiling = ceiling;
  }
}

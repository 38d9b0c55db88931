package secops.threatgraph.error.exception;

import lombok.Getter;
import secops.threatgraph.error.CommonErrorCode;
import secops.threatgraph.error.exception.base.ClientBaseException;

@Getter
public class QueryDepthExceededException extends ClientBaseException {

  private final int depth;
  private final int maxDepth;

  public QueryDepthExceededException(int depth, int maxDepth) {
    super(CommonErrorCode.QUERY_DEPTH_EXCEEDED, depth, maxDepth);
    this.depth = depth;
    this.maxDepth = maxDepth;
  }
}

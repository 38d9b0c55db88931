package secops.threatgraph.error.exception;

import secops.threatgraph.error.CommonErrorCode;
import secops.threatgraph.error.exception.base.ClientBaseException;

/** 역할 등급 부족 또는 타 조직 토픽 구독 시도 */
public class SubscriptionRejectedException extends ClientBaseException {

  public SubscriptionRejectedException(String topic) {
    super(CommonErrorCode.SUBSCRIPTION_FORBIDDEN, topic);
  }
}

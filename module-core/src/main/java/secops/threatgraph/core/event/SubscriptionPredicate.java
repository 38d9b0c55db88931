package secops.threatgraph.core.event;

import secops.threatgraph.core.domain.model.AuthContext;
import secops.threatgraph.core.domain.model.ChangeEvent;

/** 발행 시점에 구독자별로 평가하는 필터 */
@FunctionalInterface
public interface SubscriptionPredicate {

  boolean test(ChangeEvent event, AuthContext subscriber);

  default SubscriptionPredicate and(SubscriptionPredicate other) {
    return (event, subscriber) -> test(event, subscriber) && other.test(event, subscriber);
  }
}

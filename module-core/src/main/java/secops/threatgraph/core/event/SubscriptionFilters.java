package secops.threatgraph.core.event;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import secops.threatgraph.core.domain.model.ChangeKind;
import secops.threatgraph.core.domain.model.Severity;

/** 자주 쓰는 구독 필터 */
public final class SubscriptionFilters {

  public static SubscriptionPredicate always() {
    return (event, subscriber) -> true;
  }

  /** 같은 조직 이벤트만. SUPER_ADMIN은 전체, 조직이 없는 이벤트는 모두에게 전달합니다. */
  public static SubscriptionPredicate sameOrganization() {
    return (event, subscriber) ->
        event.organizationId() == null || subscriber.canAccessOrganization(event.organizationId());
  }

  public static SubscriptionPredicate minimumSeverity(Severity threshold) {
    return (event, subscriber) -> event.severity().isAtLeast(threshold);
  }

  public static SubscriptionPredicate entityIds(Collection<String> ids) {
    Set<String> watched = Set.copyOf(ids);
    return (event, subscriber) -> watched.contains(event.entityId());
  }

  public static SubscriptionPredicate entityType(String entityType) {
    return (event, subscriber) -> entityType.equals(event.entityType());
  }

  public static SubscriptionPredicate changeKinds(ChangeKind first, ChangeKind... rest) {
    Set<ChangeKind> kinds = EnumSet.of(first, rest);
    return (event, subscriber) -> kinds.contains(event.changeKind());
  }

  public static SubscriptionPredicate allOf(SubscriptionPredicate... predicates) {
    SubscriptionPredicate combined = always();
    for (SubscriptionPredicate predicate : predicates) {
      combined = combined.and(predicate);
    }
    return combined;
  }

  private SubscriptionFilters() {}
}

package secops.threatgraph.core.event;

import lombok.extern.slf4j.Slf4j;
import secops.threatgraph.core.domain.model.AuthContext;
import secops.threatgraph.core.domain.model.Role;
import secops.threatgraph.error.exception.SubscriptionRejectedException;

/**
 * 구독 시점 권한 검사
 *
 * <ul>
 *   <li>요구 역할 이상이어야 합니다 (기본 ANALYST).
 *   <li>조직 범위 토픽은 같은 조직 또는 SUPER_ADMIN만 구독할 수 있습니다.
 * </ul>
 */
@Slf4j
public class SubscriptionAuthorizer {

  private final Role requiredRole;

  public SubscriptionAuthorizer(Role requiredRole) {
    this.requiredRole = requiredRole;
  }

  public static SubscriptionAuthorizer defaults() {
    return new SubscriptionAuthorizer(Role.ANALYST);
  }

  public void check(String topic, AuthContext auth) {
    if (!auth.role().isAtLeast(requiredRole)) {
      log.info("[SubscriptionAuthorizer] Role below required: topic={}, role={}", topic, auth.role());
      throw new SubscriptionRejectedException(topic);
    }
    Topics.organizationOf(topic)
        .filter(org -> !auth.canAccessOrganization(org))
        .ifPresent(
            org -> {
              log.info("[SubscriptionAuthorizer] Foreign organization topic: topic={}", topic);
              throw new SubscriptionRejectedException(topic);
            });
  }
}

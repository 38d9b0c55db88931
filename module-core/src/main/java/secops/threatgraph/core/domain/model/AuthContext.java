package secops.threatgraph.core.domain.model;

import java.util.Objects;

/**
 * 외부 인증 계층이 제공하는 호출자 정보. 이 모듈은 자격 증명을 검증하지 않고 조건 평가에만 사용합니다.
 *
 * @param principalId 호출자 식별자 (rate limit 키)
 * @param organizationId 소속 조직
 * @param role 역할
 */
public record AuthContext(String principalId, String organizationId, Role role) {

  public AuthContext {
    Objects.requireNonNull(principalId, "principalId");
    Objects.requireNonNull(role, "role");
  }

  public boolean isSuperAdmin() {
    return role == Role.SUPER_ADMIN;
  }

  public boolean canAccessOrganization(String targetOrganizationId) {
    return isSuperAdmin() || Objects.equals(organizationId, targetOrganizationId);
  }
}

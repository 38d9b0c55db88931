package secops.threatgraph.core.domain.model;

import java.util.Objects;

/**
 * 캐시/로딩 단위를 식별하는 복합 키 {@code type:id[:suffix]}
 *
 * @param entityType 엔티티 유형 (예: threat, ioc, rel)
 * @param id 식별자
 * @param suffix 선택적 하위 구분자 (예: enrichment 키의 "ioc"), 없으면 빈 문자열
 */
public record EntityKey(String entityType, String id, String suffix) {

  private static final String SEPARATOR = ":";

  public EntityKey {
    Objects.requireNonNull(entityType, "entityType");
    Objects.requireNonNull(id, "id");
    if (entityType.isBlank() || entityType.contains(SEPARATOR)) {
      throw new IllegalArgumentException("entityType must be non-blank without ':' : " + entityType);
    }
    if (suffix == null) {
      suffix = "";
    }
  }

  public static EntityKey of(String entityType, String id) {
    return new EntityKey(entityType, id, "");
  }

  public static EntityKey of(String entityType, String id, String suffix) {
    return new EntityKey(entityType, id, suffix);
  }

  public boolean hasSuffix() {
    return !suffix.isEmpty();
  }

  public String toCacheKey() {
    if (suffix.isEmpty()) {
      return entityType + SEPARATOR + id;
    }
    return entityType + SEPARATOR + id + SEPARATOR + suffix;
  }

  @Override
  public String toString() {
    return toCacheKey();
  }
}

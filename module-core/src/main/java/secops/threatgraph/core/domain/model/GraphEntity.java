package secops.threatgraph.core.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 백엔드 저장소가 돌려주는 그래프 노드. 속성 스키마는 GraphQL 계층이 소유하므로 여기서는 불투명한 맵으로 다룹니다.
 */
public record GraphEntity(
    String type, String id, String organizationId, Map<String, Object> attributes) {

  public GraphEntity {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(id, "id");
    attributes =
        attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public static GraphEntity of(String type, String id, String organizationId) {
    return new GraphEntity(type, id, organizationId, Map.of());
  }

  public EntityKey key() {
    return EntityKey.of(type, id);
  }
}

package secops.threatgraph.core.port.out;

import java.util.List;
import java.util.Map;
import secops.threatgraph.core.domain.model.GraphEntity;

/** 일대다 관계 조회 포트. 결과 맵에 없는 부모는 빈 목록으로 취급합니다. */
public interface RelationshipStore {

  Map<String, List<GraphEntity>> findByParentIds(
      String parentType, String relation, List<String> parentIds);

  Map<String, Long> countByParentIds(String parentType, String relation, List<String> parentIds);
}

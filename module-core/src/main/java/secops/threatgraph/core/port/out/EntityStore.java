package secops.threatgraph.core.port.out;

import java.util.List;
import secops.threatgraph.core.domain.model.GraphEntity;

/** 주 저장소 조회 포트 */
public interface EntityStore {

  /**
   * @return ids와 같은 길이와 순서의 목록. 없는 id 위치는 null
   */
  List<GraphEntity> findByIds(String entityType, List<String> ids);
}

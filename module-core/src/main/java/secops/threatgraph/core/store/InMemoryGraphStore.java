package secops.threatgraph.core.store;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import secops.threatgraph.core.domain.model.GraphEntity;
import secops.threatgraph.core.port.out.EnrichmentProvider;
import secops.threatgraph.core.port.out.EntityStore;
import secops.threatgraph.core.port.out.RelationshipStore;

/**
 * 프로세스 내 그래프 저장소
 *
 * <p>{@code threatgraph.store.type=memory} 구성과 테스트에서 외부 저장소 대신 씁니다. 조회 호출 수를 세므로 배치/캐시 동작을 검증할 때
 * 사용할 수 있습니다.
 */
public class InMemoryGraphStore implements EntityStore, RelationshipStore, EnrichmentProvider {

  private final Map<String, GraphEntity> entities = new ConcurrentHashMap<>();
  private final Map<String, List<GraphEntity>> relations = new ConcurrentHashMap<>();
  private final Map<String, GraphEntity> enrichments = new ConcurrentHashMap<>();
  private final Map<String, GraphEntity> attributions = new ConcurrentHashMap<>();
  private final AtomicLong entityQueries = new AtomicLong();
  private final AtomicLong relationQueries = new AtomicLong();

  public GraphEntity save(GraphEntity entity) {
    entities.put(entityKey(entity.type(), entity.id()), entity);
    return entity;
  }

  public void remove(String entityType, String id) {
    entities.remove(entityKey(entityType, id));
  }

  public void link(String parentType, String parentId, String relation, GraphEntity child) {
    relations
        .computeIfAbsent(relationKey(parentType, parentId, relation), k -> new CopyOnWriteArrayList<>())
        .add(child);
  }

  public void putEnrichment(String iocId, GraphEntity enrichment) {
    enrichments.put(iocId, enrichment);
  }

  public void putAttribution(String threatId, GraphEntity attribution) {
    attributions.put(threatId, attribution);
  }

  @Override
  public List<GraphEntity> findByIds(String entityType, List<String> ids) {
    entityQueries.incrementAndGet();
    List<GraphEntity> result = new ArrayList<>(ids.size());
    for (String id : ids) {
      result.add(entities.get(entityKey(entityType, id)));
    }
    return result;
  }

  @Override
  public Map<String, List<GraphEntity>> findByParentIds(
      String parentType, String relation, List<String> parentIds) {
    relationQueries.incrementAndGet();
    Map<String, List<GraphEntity>> result = new HashMap<>();
    for (String parentId : parentIds) {
      List<GraphEntity> children = relations.get(relationKey(parentType, parentId, relation));
      if (children != null) {
        result.put(parentId, List.copyOf(children));
      }
    }
    return result;
  }

  @Override
  public Map<String, Long> countByParentIds(
      String parentType, String relation, List<String> parentIds) {
    relationQueries.incrementAndGet();
    Map<String, Long> result = new HashMap<>();
    for (String parentId : parentIds) {
      List<GraphEntity> children = relations.get(relationKey(parentType, parentId, relation));
      if (children != null) {
        result.put(parentId, (long) children.size());
      }
    }
    return result;
  }

  /** 보강 결과가 없으면 null */
  @Override
  public GraphEntity enrichIoc(String iocId) {
    return enrichments.get(iocId);
  }

  @Override
  public GraphEntity analyzeAttribution(String threatId) {
    return attributions.get(threatId);
  }

  public long entityQueryCount() {
    return entityQueries.get();
  }

  public long relationQueryCount() {
    return relationQueries.get();
  }

  private static String entityKey(String entityType, String id) {
    return entityType + ":" + id;
  }

  private static String relationKey(String parentType, String parentId, String relation) {
    return parentType + ":" + parentId + ":" + relation;
  }
}

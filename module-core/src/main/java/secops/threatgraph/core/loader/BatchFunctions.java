package secops.threatgraph.core.loader;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import secops.threatgraph.core.domain.model.GraphEntity;
import secops.threatgraph.core.port.out.EntityStore;
import secops.threatgraph.core.port.out.RelationshipStore;

/** 저장소 포트를 BatchFunction으로 바꾸는 어댑터 모음 */
@Slf4j
public final class BatchFunctions {

  public static BatchFunction<String, GraphEntity> entities(EntityStore store, String entityType) {
    return ids -> store.findByIds(entityType, ids);
  }

  /** 결과가 없는 부모는 null이 아닌 빈 목록으로 해소합니다. */
  public static BatchFunction<String, List<GraphEntity>> relationships(
      RelationshipStore store, String parentType, String relation) {
    return parentIds -> {
      Map<String, List<GraphEntity>> byParent =
          store.findByParentIds(parentType, relation, parentIds);
      List<List<GraphEntity>> ordered = new ArrayList<>(parentIds.size());
      for (String parentId : parentIds) {
        List<GraphEntity> children = byParent == null ? null : byParent.get(parentId);
        ordered.add(children == null ? List.of() : List.copyOf(children));
      }
      return ordered;
    };
  }

  /** 결과가 없는 부모는 0 */
  public static BatchFunction<String, Long> counts(
      RelationshipStore store, String parentType, String relation) {
    return parentIds -> {
      Map<String, Long> byParent = store.countByParentIds(parentType, relation, parentIds);
      List<Long> ordered = new ArrayList<>(parentIds.size());
      for (String parentId : parentIds) {
        Long count = byParent == null ? null : byParent.get(parentId);
        ordered.add(count == null ? 0L : count);
      }
      return ordered;
    };
  }

  /**
   * 키마다 개별 호출하는 배치 함수. 한 키의 실패는 그 키만 null로 만들고 나머지 키는 정상 해소됩니다.
   */
  public static <K, V> BatchFunction<K, V> perKey(String loaderName, PerKeyFetcher<K, V> fetcher) {
    return keys -> {
      List<V> values = new ArrayList<>(keys.size());
      for (K key : keys) {
        values.add(fetchOne(loaderName, fetcher, key));
      }
      return values;
    };
  }

  private static <K, V> V fetchOne(String loaderName, PerKeyFetcher<K, V> fetcher, K key) {
    try {
      return fetcher.fetch(key);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("[BatchLoader] Interrupted while fetching: loader={}, key={}", loaderName, key);
      return null;
    } catch (Exception e) {
      log.warn("[BatchLoader] Key fetch failed, resolving null: loader={}, key={}, cause={}", loaderName, key, e.toString());
      return null;
    }
  }

  @FunctionalInterface
  public interface PerKeyFetcher<K, V> {
    V fetch(K key) throws Exception;
  }

  private BatchFunctions() {}
}

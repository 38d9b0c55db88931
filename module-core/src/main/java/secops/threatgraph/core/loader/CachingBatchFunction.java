package secops.threatgraph.core.loader;

import com.fasterxml.jackson.databind.JavaType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import secops.threatgraph.core.cache.EntityCacheManager;
import secops.threatgraph.core.domain.model.EntityKey;
import secops.threatgraph.error.exception.BatchFetchException;

/**
 * cache-aside 배치 함수
 *
 * <p>공유 캐시에서 먼저 mget으로 찾고, 미스인 키만 위임 함수로 가져온 뒤 mset으로 되써 넣습니다. 캐시 장애 시 캐시 매니저가 미스로 처리하므로
 * 위임 함수가 전체 키를 조회합니다. 위임 함수 결과 길이가 미스 키 수와 다르면 아무 것도 캐시하지 않고 {@link BatchFetchException}을
 * 던집니다.
 */
public class CachingBatchFunction<K, V> implements BatchFunction<K, V> {

  private final String name;
  private final BatchFunction<K, V> delegate;
  private final EntityCacheManager cacheManager;
  private final Function<K, EntityKey> keyMapper;
  private final JavaType valueType;

  public CachingBatchFunction(
      String name,
      BatchFunction<K, V> delegate,
      EntityCacheManager cacheManager,
      Function<K, EntityKey> keyMapper,
      JavaType valueType) {
    this.name = name;
    this.delegate = delegate;
    this.cacheManager = cacheManager;
    this.keyMapper = keyMapper;
    this.valueType = valueType;
  }

  @Override
  public List<V> fetch(List<K> keys) throws Exception {
    Map<K, EntityKey> cacheKeys = new LinkedHashMap<>();
    keys.forEach(key -> cacheKeys.put(key, keyMapper.apply(key)));
    Map<EntityKey, V> cached = cacheManager.mget(cacheKeys.values(), valueType);

    List<K> misses = new ArrayList<>();
    for (K key : keys) {
      if (!cached.containsKey(cacheKeys.get(key))) {
        misses.add(key);
      }
    }
    Map<K, V> fetched = fetchMisses(misses);

    List<V> values = new ArrayList<>(keys.size());
    for (K key : keys) {
      EntityKey cacheKey = cacheKeys.get(key);
      values.add(cached.containsKey(cacheKey) ? cached.get(cacheKey) : fetched.get(key));
    }
    return values;
  }

  private Map<K, V> fetchMisses(List<K> misses) throws Exception {
    Map<K, V> fetched = new LinkedHashMap<>();
    if (misses.isEmpty()) {
      return fetched;
    }
    List<V> values = delegate.fetch(misses);
    if (values == null || values.size() != misses.size()) {
      throw new BatchFetchException(
          name,
          "size mismatch: expected=" + misses.size() + ", actual=" + (values == null ? "null" : values.size()));
    }
    Map<EntityKey, V> toCache = new LinkedHashMap<>();
    for (int i = 0; i < misses.size(); i++) {
      V value = values.get(i);
      fetched.put(misses.get(i), value);
      if (value != null) {
        toCache.put(keyMapper.apply(misses.get(i)), value);
      }
    }
    cacheManager.mset(toCache, null);
    return fetched;
  }
}

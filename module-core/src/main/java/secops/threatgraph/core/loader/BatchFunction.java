package secops.threatgraph.core.loader;

import java.util.List;

/**
 * 다건 조회 함수
 *
 * <p>반환 목록은 keys와 같은 길이와 순서여야 합니다. 없는 키 위치는 null을 둡니다.
 */
@FunctionalInterface
public interface BatchFunction<K, V> {

  List<V> fetch(List<K> keys) throws Exception;
}

package secops.threatgraph.core.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 직렬화된 캐시 값과 만료 시각
 *
 * <p>expiresAt이 지난 엔트리는 조회 시 존재하지 않는 것으로 취급합니다.
 */
public record CacheEntry(String key, String serializedValue, Instant expiresAt, List<String> tags) {

  public CacheEntry {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(serializedValue, "serializedValue");
    Objects.requireNonNull(expiresAt, "expiresAt");
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public static CacheEntry of(String key, String serializedValue, Instant expiresAt) {
    return new CacheEntry(key, serializedValue, expiresAt, List.of());
  }

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }
}

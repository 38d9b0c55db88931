package secops.threatgraph.core.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;
import secops.threatgraph.core.domain.model.EntityKey;

/** 파생 캐시 키 생성 규칙 */
public final class CacheKeys {

  /** {@code rel:{parentType}:{parentId}:{relation}} */
  public static EntityKey relationship(String parentType, String parentId, String relation) {
    return EntityKey.of(CacheType.RELATIONSHIP.getPrefix(), parentType + ":" + parentId, relation);
  }

  /** {@code enrichment:{iocId}:ioc} */
  public static EntityKey iocEnrichment(String iocId) {
    return EntityKey.of(CacheType.ENRICHMENT.getPrefix(), iocId, "ioc");
  }

  public static EntityKey attribution(String threatId) {
    return EntityKey.of(CacheType.ATTRIBUTION.getPrefix(), threatId);
  }

  /** {@code analytics:{organizationId}:{analyticsType}:{timeRange}} */
  public static EntityKey analytics(String organizationId, String analyticsType, String timeRange) {
    return EntityKey.of(
        CacheType.ANALYTICS.getPrefix(), organizationId + ":" + analyticsType, timeRange);
  }

  public static EntityKey dashboard(String organizationId, String view) {
    return EntityKey.of(CacheType.DASHBOARD.getPrefix(), organizationId, view);
  }

  /**
   * 검색 결과 키. 필터 순서와 무관하게 같은 키가 나오도록 정렬 후 해시합니다.
   */
  public static EntityKey search(String query, Map<String, ?> filters, String sort) {
    String canonical =
        query + "|" + new TreeMap<>(filters == null ? Map.of() : filters) + "|" + sort;
    return EntityKey.of(CacheType.SEARCH.getPrefix(), sha256(canonical).substring(0, 32));
  }

  private static String sha256(String text) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 unavailable", e);
    }
  }

  private CacheKeys() {}
}

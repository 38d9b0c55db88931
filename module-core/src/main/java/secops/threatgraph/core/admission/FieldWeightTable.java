package secops.threatgraph.core.admission;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 정적 필드 가중치 표 {@code "Type.field" → 가중치}
 *
 * <p>런타임 스키마 리플렉션 없이 요청 형태 크기에 비례한 시간으로 비용을 계산하기 위한 표입니다. 표에 없는 필드는 가중치 1의 스칼라로 봅니다.
 */
public final class FieldWeightTable {

  static final int SCALAR_WEIGHT = 1;

  private final Map<String, FieldWeight> weights;

  private FieldWeightTable(Map<String, FieldWeight> weights) {
    this.weights = Collections.unmodifiableMap(weights);
  }

  /**
   * @param weight 필드 자체 비용
   * @param returnType 하위 필드 조회에 쓸 반환 타입명
   * @param sizeArgument 리스트 필드의 크기 인자명 (first, limit). 리스트가 아니면 null
   */
  public record FieldWeight(int weight, String returnType, String sizeArgument) {
    public boolean isList() {
      return sizeArgument != null;
    }
  }

  public Optional<FieldWeight> lookup(String parentType, String field) {
    return Optional.ofNullable(weights.get(parentType + "." + field));
  }

  public int size() {
    return weights.size();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * 위협 인텔리전스 스키마 기본 표
   *
   * <p>스칼라 1, 관계/리스트 10~25, 고비용 계산/보강 100~500. Connection의 edges는 2이며 부모의 first 배수를 받습니다.
   */
  public static FieldWeightTable threatIntelDefaults() {
    return builder()
        // Query
        .field("Query", "threat", 1, "Threat")
        .list("Query", "threats", 10, "ThreatConnection", "first")
        .field("Query", "ioc", 1, "IOC")
        .list("Query", "iocs", 10, "IOCConnection", "first")
        .field("Query", "threatActor", 1, "ThreatActor")
        .list("Query", "threatActors", 10, "ThreatActorConnection", "first")
        .field("Query", "campaign", 1, "Campaign")
        .list("Query", "campaigns", 10, "CampaignConnection", "first")
        .field("Query", "threatFeed", 1, "ThreatFeed")
        .list("Query", "threatFeeds", 10, "ThreatFeed", "first")
        .list("Query", "searchThreats", 25, "Threat", "limit")
        .list("Query", "searchIOCs", 25, "IOC", "limit")
        .field("Query", "threatAnalytics", 100, "ThreatAnalytics")
        .list("Query", "correlateThreats", 200, "Correlation", "limit")
        .field("Query", "dashboard", 50, "Dashboard")
        // Connection
        .field("ThreatConnection", "edges", 2, "ThreatEdge")
        .field("ThreatEdge", "node", 0, "Threat")
        .field("IOCConnection", "edges", 2, "IOCEdge")
        .field("IOCEdge", "node", 0, "IOC")
        .field("ThreatActorConnection", "edges", 2, "ThreatActorEdge")
        .field("ThreatActorEdge", "node", 0, "ThreatActor")
        .field("CampaignConnection", "edges", 2, "CampaignEdge")
        .field("CampaignEdge", "node", 0, "Campaign")
        // Threat
        .list("Threat", "iocs", 10, "IOC", "first")
        .list("Threat", "actors", 10, "ThreatActor", "first")
        .list("Threat", "campaigns", 10, "Campaign", "first")
        .list("Threat", "timeline", 25, "TimelineEvent", "first")
        .field("Threat", "attribution", 100, "Attribution")
        .list("Threat", "correlations", 200, "Correlation", "limit")
        // IOC
        .field("IOC", "enrichment", 500, "Enrichment")
        .list("IOC", "threats", 10, "Threat", "first")
        .list("IOC", "relatedIOCs", 25, "IOC", "first")
        // ThreatActor
        .list("ThreatActor", "threats", 10, "Threat", "first")
        .list("ThreatActor", "campaigns", 10, "Campaign", "first")
        .list("ThreatActor", "iocs", 10, "IOC", "first")
        .list("ThreatActor", "activity", 25, "ActorActivity", "first")
        // Campaign
        .list("Campaign", "threats", 10, "Threat", "first")
        .list("Campaign", "actors", 10, "ThreatActor", "first")
        .list("Campaign", "iocs", 10, "IOC", "first")
        // ThreatFeed
        .list("ThreatFeed", "iocs", 10, "IOC", "first")
        .field("ThreatFeed", "stats", 100, "FeedStats")
        // Mutation
        .field("Mutation", "createThreat", 10, "Threat")
        .field("Mutation", "updateThreat", 10, "Threat")
        .field("Mutation", "createIOC", 10, "IOC")
        .field("Mutation", "updateIOC", 10, "IOC")
        .list("Mutation", "bulkImportIOCs", 50, "IOC", "batchSize")
        .field("Mutation", "enrichIOC", 500, "Enrichment")
        .build();
  }

  public static final class Builder {
    private final Map<String, FieldWeight> weights = new HashMap<>();

    public Builder field(String parentType, String field, int weight, String returnType) {
      weights.put(parentType + "." + field, new FieldWeight(weight, returnType, null));
      return this;
    }

    public Builder list(
        String parentType, String field, int weight, String returnType, String sizeArgument) {
      weights.put(parentType + "." + field, new FieldWeight(weight, returnType, sizeArgument));
      return this;
    }

    public FieldWeightTable build() {
      return new FieldWeightTable(new HashMap<>(weights));
    }
  }
}

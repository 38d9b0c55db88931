package secops.threatgraph.core.event;

import java.util.Optional;

/** 토픽 이름과 조직 범위 토픽 규칙 {@code BASE:{organizationId}} */
public final class Topics {

  public static final String THREAT_INTELLIGENCE_UPDATE = "THREAT_INTELLIGENCE_UPDATE";
  public static final String IOC_MATCH = "IOC_MATCH";
  public static final String NEW_IOC = "NEW_IOC";
  public static final String THREAT_FEED_UPDATE = "THREAT_FEED_UPDATE";
  public static final String CORRELATION_MATCH = "CORRELATION_MATCH";
  public static final String ATTRIBUTION_UPDATE = "ATTRIBUTION_UPDATE";
  public static final String THREAT_ACTOR_ACTIVITY = "THREAT_ACTOR_ACTIVITY";
  public static final String THREAT_CAMPAIGN_UPDATE = "THREAT_CAMPAIGN_UPDATE";

  private static final char SEPARATOR = ':';

  public static String forOrganization(String baseTopic, String organizationId) {
    return baseTopic + SEPARATOR + organizationId;
  }

  public static Optional<String> organizationOf(String topic) {
    int idx = topic.indexOf(SEPARATOR);
    return idx < 0 ? Optional.empty() : Optional.of(topic.substring(idx + 1));
  }

  /** 엔티티 유형별 기본 토픽 */
  public static String baseTopicFor(String entityType) {
    return switch (entityType) {
      case "ioc" -> NEW_IOC;
      case "feed" -> THREAT_FEED_UPDATE;
      case "actor" -> THREAT_ACTOR_ACTIVITY;
      case "campaign" -> THREAT_CAMPAIGN_UPDATE;
      case "attribution" -> ATTRIBUTION_UPDATE;
      case "correlation" -> CORRELATION_MATCH;
      default -> THREAT_INTELLIGENCE_UPDATE;
    };
  }

  private Topics() {}
}

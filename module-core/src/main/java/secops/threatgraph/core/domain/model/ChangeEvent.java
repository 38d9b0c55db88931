package secops.threatgraph.core.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 변경 성공 후 발행되는 도메인 이벤트. 발행 이후에는 변경되지 않습니다.
 *
 * @param topic 발행 토픽 (조직 범위 토픽 포함)
 * @param severity 생략 시 LOW
 * @param organizationId 조직 필터 기준, 전역 이벤트면 null
 */
public record ChangeEvent(
    String topic,
    String entityType,
    String entityId,
    ChangeKind changeKind,
    Severity severity,
    String organizationId,
    Map<String, Object> payload,
    Instant timestamp) {

  public ChangeEvent {
    Objects.requireNonNull(topic, "topic");
    Objects.requireNonNull(entityType, "entityType");
    Objects.requireNonNull(entityId, "entityId");
    Objects.requireNonNull(changeKind, "changeKind");
    Objects.requireNonNull(timestamp, "timestamp");
    severity = severity == null ? Severity.LOW : severity;
    payload =
        payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }

  @JsonIgnore
  public boolean isCritical() {
    return severity == Severity.CRITICAL;
  }

  /** 같은 내용을 다른 토픽으로 재발행할 때 사용 */
  public ChangeEvent withTopic(String newTopic) {
    return new ChangeEvent(
        newTopic, entityType, entityId, changeKind, severity, organizationId, payload, timestamp);
  }
}

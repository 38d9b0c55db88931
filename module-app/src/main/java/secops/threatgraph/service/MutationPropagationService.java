package secops.threatgraph.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import secops.threatgraph.core.cache.EntityCacheManager;
import secops.threatgraph.core.domain.model.ChangeEvent;
import secops.threatgraph.core.domain.model.ChangeKind;
import secops.threatgraph.core.domain.model.GraphEntity;
import secops.threatgraph.core.domain.model.Severity;
import secops.threatgraph.core.event.Topics;
import secops.threatgraph.core.loader.ThreatGraphLoaders;
import secops.threatgraph.core.port.out.ChangeEventPublisher;

/**
 * 주 저장소 쓰기 성공 후 전파
 *
 * <p>순서: 캐시 cascade 무효화 → 새 값 적재 → 변경 이벤트 발행. 이벤트를 받은 구독자가 다시 읽을 때 이전 값이 보이지 않도록 무효화를 먼저
 * 끝냅니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MutationPropagationService {

  private final EntityCacheManager cacheManager;
  private final ChangeEventPublisher eventPublisher;
  private final Clock clock;

  /**
   * @param entity 변경 후 엔티티. DELETED면 type/id/organizationId만 의미가 있습니다.
   * @return 발행된 이벤트 (조직 토픽 기준)
   */
  public ChangeEvent afterWrite(GraphEntity entity, ChangeKind kind, Severity severity) {
    long removed = cacheManager.invalidate(entity.type(), entity.id());
    if (kind != ChangeKind.DELETED) {
      cacheManager.set(entity.key(), entity);
    }

    ChangeEvent event = toEvent(entity, kind, severity);
    eventPublisher.publish(event);
    if (entity.organizationId() != null) {
      eventPublisher.publish(event.withTopic(Topics.baseTopicFor(entity.type())));
    }

    log.debug(
        "[MutationPropagation] Propagated: entity={}:{}, kind={}, removedKeys={}, topic={}",
        entity.type(),
        entity.id(),
        kind,
        removed,
        event.topic());
    return event;
  }

  /** 같은 요청 안에서 쓰기 후 읽기를 할 때 요청 범위 로더 값도 갱신합니다. */
  public ChangeEvent afterWrite(
      GraphEntity entity, ChangeKind kind, Severity severity, ThreatGraphLoaders loaders) {
    ChangeEvent event = afterWrite(entity, kind, severity);
    loaders.evict(entity.type(), entity.id());
    if (kind != ChangeKind.DELETED && ThreatGraphLoaders.ENTITY_TYPES.contains(entity.type())) {
      loaders.entity(entity.type()).prime(entity.id(), entity);
    }
    return event;
  }

  /** 조직이 있으면 {@code BASE:{organizationId}}, 없으면 기본 토픽 */
  private ChangeEvent toEvent(GraphEntity entity, ChangeKind kind, Severity severity) {
    String baseTopic = Topics.baseTopicFor(entity.type());
    String topic =
        entity.organizationId() == null
            ? baseTopic
            : Topics.forOrganization(baseTopic, entity.organizationId());
    Map<String, Object> payload = kind == ChangeKind.DELETED ? Map.of() : entity.attributes();
    return new ChangeEvent(
        topic,
        entity.type(),
        entity.id(),
        kind,
        severity,
        entity.organizationId(),
        payload,
        Instant.now(clock));
  }
}

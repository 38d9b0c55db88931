package secops.threatgraph.infrastructure.cache.invalidation;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.api.listener.MessageListener;
import org.redisson.client.codec.StringCodec;
import secops.threatgraph.core.cache.EntityCacheManager;
import secops.threatgraph.core.port.out.CacheInvalidationEvent;
import secops.threatgraph.global.executor.LogicExecutor;
import secops.threatgraph.global.executor.TaskContext;
import secops.threatgraph.global.executor.strategy.ExceptionTranslator;

/**
 * Redis RTopic 기반 L1 무효화 이벤트 구독자
 *
 * <p>다른 인스턴스가 발행한 이벤트를 받아 이 인스턴스의 near-cache만 비웁니다. L2는 모든 인스턴스가 공유하므로 다시 지우지 않습니다.
 *
 * <ul>
 *   <li>Self-skip: 자기 자신이 발행한 이벤트는 무시
 *   <li>유실 시 L1 최대 TTL이 상한
 * </ul>
 */
@Slf4j
public class RedisCacheInvalidationSubscriber {

  private final RedissonClient redissonClient;
  private final String topicName;
  private final String instanceId;
  private final EntityCacheManager cacheManager;
  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;

  private volatile RTopic topic;
  private volatile Integer listenerId;

  public RedisCacheInvalidationSubscriber(
      RedissonClient redissonClient,
      String topicName,
      String instanceId,
      EntityCacheManager cacheManager,
      ObjectMapper objectMapper,
      LogicExecutor executor,
      MeterRegistry meterRegistry) {
    this.redissonClient = redissonClient;
    this.topicName = topicName;
    this.instanceId = instanceId;
    this.cacheManager = cacheManager;
    this.objectMapper = objectMapper;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  public void subscribe() {
    listenerId =
        executor.executeWithTranslation(
            () -> {
              topic = redissonClient.getTopic(topicName, StringCodec.INSTANCE);
              int id = topic.addListener(String.class, createMessageListener());
              log.info(
                  "[CacheInvalidation] Subscribed to topic: {}, instanceId={}", topicName, instanceId);
              return id;
            },
            ExceptionTranslator.forStartup("CacheInvalidationSubscriber"),
            TaskContext.of("CacheInvalidation", "Subscribe", instanceId));
  }

  private MessageListener<String> createMessageListener() {
    return (channel, payload) -> onMessage(payload);
  }

  void onMessage(String payload) {
    CacheInvalidationEvent event =
        executor.executeWithTranslation(
            () -> objectMapper.readValue(payload, CacheInvalidationEvent.class),
            ExceptionTranslator.forJson(),
            TaskContext.of("CacheInvalidation", "Decode", topicName));
    onEvent(event);
  }

  public void onEvent(CacheInvalidationEvent event) {
    if (instanceId.equals(event.sourceInstanceId())) {
      log.trace("[CacheInvalidation] Self-skip: type={}", event.type());
      return;
    }
    executor.executeVoid(
        () -> {
          cacheManager.onRemoteInvalidation(event);
          meterRegistry
              .counter("cache.invalidation.received", "type", event.type().name())
              .increment();
          log.debug(
              "[CacheInvalidation] L1 invalidated: type={}, targets={}, source={}",
              event.type(),
              event.targets().size(),
              event.sourceInstanceId());
        },
        TaskContext.of("CacheInvalidation", "OnEvent", event.type().name()));
  }

  public void unsubscribe() {
    executor.executeVoid(
        () -> {
          if (topic != null && listenerId != null) {
            topic.removeListener(listenerId);
            log.info("[CacheInvalidation] Unsubscribed from topic: instanceId={}", instanceId);
          }
        },
        TaskContext.of("CacheInvalidation", "Unsubscribe", instanceId));
  }
}

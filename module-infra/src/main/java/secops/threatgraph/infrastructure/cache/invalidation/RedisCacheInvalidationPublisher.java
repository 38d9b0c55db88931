package secops.threatgraph.infrastructure.cache.invalidation;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import secops.threatgraph.core.port.out.CacheInvalidationEvent;
import secops.threatgraph.core.port.out.CacheInvalidationPublisher;
import secops.threatgraph.global.executor.LogicExecutor;
import secops.threatgraph.global.executor.TaskContext;

/**
 * Redis RTopic 기반 L1 무효화 이벤트 발행자
 *
 * <p>이벤트는 JSON 문자열로 보냅니다. Pub/Sub 장애 시에도 캐시 기능은 그대로 동작하며, 다른 인스턴스의 L1 사본은 L1 최대 TTL이 지나면
 * 사라집니다.
 */
@Slf4j
public class RedisCacheInvalidationPublisher implements CacheInvalidationPublisher {

  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;
  private final RTopic topic;

  public RedisCacheInvalidationPublisher(
      RedissonClient redissonClient,
      String topicName,
      ObjectMapper objectMapper,
      LogicExecutor executor,
      MeterRegistry meterRegistry) {
    this.objectMapper = objectMapper;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
    this.topic = redissonClient.getTopic(topicName, StringCodec.INSTANCE);
  }

  @Override
  public void publish(CacheInvalidationEvent event) {
    TaskContext context = TaskContext.of("CacheInvalidation", "Publish", event.type().name());

    long clientsReceived =
        executor.executeOrDefault(
            () -> topic.publish(objectMapper.writeValueAsString(event)), 0L, context);

    recordPublishResult(clientsReceived, event);
  }

  private void recordPublishResult(long clientsReceived, CacheInvalidationEvent event) {
    if (clientsReceived > 0) {
      meterRegistry.counter("cache.invalidation.publish", "status", "success").increment();
      log.debug(
          "[CacheInvalidation] Published: type={}, targets={}, clients={}",
          event.type(),
          event.targets().size(),
          clientsReceived);
    } else {
      meterRegistry.counter("cache.invalidation.publish", "status", "failure").increment();
      log.warn(
          "[CacheInvalidation] Publish failed or no subscribers: type={}, targets={}",
          event.type(),
          event.targets().size());
    }
  }
}

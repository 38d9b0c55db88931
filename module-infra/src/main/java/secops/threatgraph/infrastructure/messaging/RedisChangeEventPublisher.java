package secops.threatgraph.infrastructure.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import secops.threatgraph.core.domain.model.ChangeEvent;
import secops.threatgraph.core.event.SubscriptionRouter;
import secops.threatgraph.core.port.out.ChangeEventPublisher;
import secops.threatgraph.global.executor.LogicExecutor;
import secops.threatgraph.global.executor.TaskContext;

/**
 * Redis RTopic 기반 클러스터 변경 이벤트 발행자
 *
 * <p>모든 인스턴스의 {@link RedisChangeEventRelay}가 같은 채널을 구독하므로 발행한 인스턴스도 채널을 통해 이벤트를 받습니다. 발행이 실패하면
 * 이 인스턴스의 라우터에만 직접 전달합니다(다른 인스턴스 구독자는 이 이벤트를 받지 못함).
 */
@Slf4j
public class RedisChangeEventPublisher implements ChangeEventPublisher {

  private final RTopic topic;
  private final SubscriptionRouter localRouter;
  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;

  public RedisChangeEventPublisher(
      RedissonClient redissonClient,
      String channelName,
      SubscriptionRouter localRouter,
      ObjectMapper objectMapper,
      LogicExecutor executor) {
    this.topic = redissonClient.getTopic(channelName, StringCodec.INSTANCE);
    this.localRouter = localRouter;
    this.objectMapper = objectMapper;
    this.executor = executor;
  }

  @Override
  public void publish(ChangeEvent event) {
    executor.executeOrCatch(
        () -> publishInternal(event),
        e -> deliverLocally(event, e),
        TaskContext.of("RedisChangeEventPublisher", "Publish", event.topic()));
  }

  private long publishInternal(ChangeEvent event) throws Exception {
    String payload = objectMapper.writeValueAsString(event);
    long receivers = topic.publish(payload);
    log.debug(
        "[RedisChangeEventPublisher] Published: topic={}, entity={}:{}, receivers={}",
        event.topic(),
        event.entityType(),
        event.entityId(),
        receivers);
    return receivers;
  }

  private long deliverLocally(ChangeEvent event, Throwable cause) {
    log.warn(
        "[RedisChangeEventPublisher] Cluster publish failed, delivering locally: topic={}, cause={}",
        event.topic(),
        cause.toString());
    return localRouter.publish(event.topic(), event);
  }
}

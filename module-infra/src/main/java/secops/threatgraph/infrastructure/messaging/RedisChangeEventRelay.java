package secops.threatgraph.infrastructure.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import secops.threatgraph.core.domain.model.ChangeEvent;
import secops.threatgraph.core.event.SubscriptionRouter;
import secops.threatgraph.global.executor.LogicExecutor;
import secops.threatgraph.global.executor.TaskContext;
import secops.threatgraph.global.executor.strategy.ExceptionTranslator;

/** 클러스터 채널의 변경 이벤트를 이 인스턴스의 {@link SubscriptionRouter}로 넘깁니다. */
@Slf4j
public class RedisChangeEventRelay {

  private final RedissonClient redissonClient;
  private final String channelName;
  private final SubscriptionRouter router;
  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;

  private volatile RTopic topic;
  private volatile Integer listenerId;

  public RedisChangeEventRelay(
      RedissonClient redissonClient,
      String channelName,
      SubscriptionRouter router,
      ObjectMapper objectMapper,
      LogicExecutor executor) {
    this.redissonClient = redissonClient;
    this.channelName = channelName;
    this.router = router;
    this.objectMapper = objectMapper;
    this.executor = executor;
  }

  public void start() {
    listenerId =
        executor.executeWithTranslation(
            () -> {
              topic = redissonClient.getTopic(channelName, StringCodec.INSTANCE);
              int id = topic.addListener(String.class, (channel, payload) -> onMessage(payload));
              log.info("[ChangeEventRelay] Listening: channel={}", channelName);
              return id;
            },
            ExceptionTranslator.forStartup("ChangeEventRelay"),
            TaskContext.of("ChangeEventRelay", "Start", channelName));
  }

  /**
   * @return 이벤트가 들어간 로컬 구독 수
   */
  int onMessage(String payload) {
    ChangeEvent event =
        executor.executeWithTranslation(
            () -> objectMapper.readValue(payload, ChangeEvent.class),
            ExceptionTranslator.forJson(),
            TaskContext.of("ChangeEventRelay", "Decode", channelName));
    return router.publish(event.topic(), event);
  }

  public void stop() {
    executor.executeVoid(
        () -> {
          if (topic != null && listenerId != null) {
            topic.removeListener(listenerId);
            log.info("[ChangeEventRelay] Stopped: channel={}", channelName);
          }
        },
        TaskContext.of("ChangeEventRelay", "Stop", channelName));
  }
}

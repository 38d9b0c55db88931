package secops.threatgraph.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import secops.threatgraph.core.event.LocalChangeEventPublisher;
import secops.threatgraph.core.event.SubscriptionAuthorizer;
import secops.threatgraph.core.event.SubscriptionRouter;
import secops.threatgraph.core.port.out.ChangeEventPublisher;
import secops.threatgraph.global.executor.LogicExecutor;
import secops.threatgraph.infrastructure.messaging.RedisChangeEventPublisher;
import secops.threatgraph.infrastructure.messaging.RedisChangeEventRelay;

/**
 * 구독 라우터와 변경 이벤트 발행자
 *
 * <p>memory 구성은 라우터로 바로 전달하고, redis 구성은 RTopic으로 모든 인스턴스에 보낸 뒤 각 인스턴스의 중계기가 자기 라우터로 넘깁니다.
 */
@Slf4j
@Configuration
public class EventBusConfig {

  @Bean
  public SubscriptionRouter subscriptionRouter(
      SubscriptionProperties properties,
      MeterRegistry meterRegistry,
      @Qualifier("subscriptionNotifyExecutor") ThreadPoolTaskExecutor subscriptionNotifyExecutor) {
    log.info(
        "[EventBusConfig] SubscriptionRouter: queueCapacity={}, requiredRole={}",
        properties.getQueueCapacity(),
        properties.getRequiredRole());
    return new SubscriptionRouter(
        new SubscriptionAuthorizer(properties.getRequiredRole()),
        properties.getQueueCapacity(),
        meterRegistry,
        subscriptionNotifyExecutor);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "threatgraph.store",
      name = "type",
      havingValue = "memory",
      matchIfMissing = true)
  public ChangeEventPublisher localChangeEventPublisher(SubscriptionRouter subscriptionRouter) {
    return new LocalChangeEventPublisher(subscriptionRouter);
  }

  @Configuration
  @ConditionalOnProperty(prefix = "threatgraph.store", name = "type", havingValue = "redis")
  static class RedisEventBusConfig {

    @Bean
    public ChangeEventPublisher redisChangeEventPublisher(
        RedissonClient redissonClient,
        SubscriptionProperties properties,
        SubscriptionRouter subscriptionRouter,
        ObjectMapper objectMapper,
        LogicExecutor logicExecutor) {
      return new RedisChangeEventPublisher(
          redissonClient,
          properties.getEventChannel(),
          subscriptionRouter,
          objectMapper,
          logicExecutor);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public RedisChangeEventRelay redisChangeEventRelay(
        RedissonClient redissonClient,
        SubscriptionProperties properties,
        SubscriptionRouter subscriptionRouter,
        ObjectMapper objectMapper,
        LogicExecutor logicExecutor) {
      return new RedisChangeEventRelay(
          redissonClient,
          properties.getEventChannel(),
          subscriptionRouter,
          objectMapper,
          logicExecutor);
    }
  }
}

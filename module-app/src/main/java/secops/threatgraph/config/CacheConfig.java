package secops.threatgraph.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import secops.threatgraph.core.cache.CacheSettings;
import secops.threatgraph.core.cache.CascadeCoverageVerifier;
import secops.threatgraph.core.cache.CascadeRules;
import secops.threatgraph.core.cache.EntityCacheManager;
import secops.threatgraph.core.port.out.CacheInvalidationPublisher;
import secops.threatgraph.core.port.out.SharedCacheStore;
import secops.threatgraph.global.executor.LogicExecutor;
import secops.threatgraph.infrastructure.cache.invalidation.RedisCacheInvalidationPublisher;
import secops.threatgraph.infrastructure.cache.invalidation.RedisCacheInvalidationSubscriber;

/**
 * 2계층 캐시 설정
 *
 * <p>redis 구성에서는 L1 무효화 이벤트를 RTopic으로 주고받고, memory 구성에서는 인스턴스가 하나뿐이므로 발행하지 않습니다.
 */
@Slf4j
@Configuration
public class CacheConfig {

  private final CacheProperties properties;
  private final String instanceId;

  public CacheConfig(
      CacheProperties properties,
      @Value("${threatgraph.instance-id:${HOSTNAME:unknown}}") String instanceId) {
    this.properties = properties;
    this.instanceId = instanceId;
  }

  @Bean
  public CascadeRules cascadeRules() {
    CascadeRules rules = CascadeRules.defaults();
    CascadeCoverageVerifier.verify(rules, properties.getCoverageCheck());
    return rules;
  }

  @Bean
  public CacheSettings cacheSettings() {
    return properties.toSettings(instanceId);
  }

  @Bean
  public EntityCacheManager entityCacheManager(
      SharedCacheStore sharedCacheStore,
      ObjectMapper objectMapper,
      LogicExecutor logicExecutor,
      CacheInvalidationPublisher cacheInvalidationPublisher,
      CascadeRules cascadeRules,
      CacheSettings cacheSettings,
      Clock clock,
      MeterRegistry meterRegistry) {
    log.info(
        "[CacheConfig] EntityCacheManager: instanceId={}, l1Enabled={}, l1MaxTtl={}",
        instanceId,
        cacheSettings.l1Enabled(),
        cacheSettings.l1MaxTtl());
    return new EntityCacheManager(
        sharedCacheStore,
        objectMapper,
        logicExecutor,
        cacheInvalidationPublisher,
        cascadeRules,
        cacheSettings,
        clock,
        meterRegistry);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "threatgraph.store",
      name = "type",
      havingValue = "memory",
      matchIfMissing = true)
  public CacheInvalidationPublisher noopCacheInvalidationPublisher() {
    return CacheInvalidationPublisher.NOOP;
  }

  @Configuration
  @ConditionalOnProperty(prefix = "threatgraph.store", name = "type", havingValue = "redis")
  static class RedisInvalidationConfig {

    @Bean
    public CacheInvalidationPublisher redisCacheInvalidationPublisher(
        RedissonClient redissonClient,
        CacheProperties properties,
        ObjectMapper objectMapper,
        LogicExecutor logicExecutor,
        MeterRegistry meterRegistry) {
      return new RedisCacheInvalidationPublisher(
          redissonClient,
          properties.getInvalidationChannel(),
          objectMapper,
          logicExecutor,
          meterRegistry);
    }

    @Bean(initMethod = "subscribe", destroyMethod = "unsubscribe")
    public RedisCacheInvalidationSubscriber redisCacheInvalidationSubscriber(
        RedissonClient redissonClient,
        CacheProperties properties,
        CacheSettings cacheSettings,
        EntityCacheManager entityCacheManager,
        ObjectMapper objectMapper,
        LogicExecutor logicExecutor,
        MeterRegistry meterRegistry) {
      return new RedisCacheInvalidationSubscriber(
          redissonClient,
          properties.getInvalidationChannel(),
          cacheSettings.instanceId(),
          entityCacheManager,
          objectMapper,
          logicExecutor,
          meterRegistry);
    }
  }
}

package secops.threatgraph.global.ratelimit.config;

import io.github.bucket4j.distributed.ExpirationAfterWriteStrategy;
import io.github.bucket4j.distributed.proxy.ProxyManager;
import io.github.bucket4j.redis.redisson.Bucket4jRedisson;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import secops.threatgraph.core.port.out.RateLimiter;
import secops.threatgraph.global.executor.LogicExecutor;
import secops.threatgraph.infrastructure.ratelimit.Bucket4jRateLimiter;
import secops.threatgraph.infrastructure.ratelimit.BucketResolver;
import secops.threatgraph.infrastructure.ratelimit.LocalBucketResolver;
import secops.threatgraph.infrastructure.ratelimit.ProxyManagerBucketResolver;

/**
 * Bucket4j 설정
 *
 * <ul>
 *   <li>redis 구성: Redisson CAS ProxyManager로 인스턴스 간 원자적 차감
 *   <li>memory 구성: 프로세스 내 버킷. 충전 시간 + bucketExpiration 동안 접근이 없으면 제거
 * </ul>
 *
 * <p>ratelimit.enabled=false면 RateLimiter 빈을 만들지 않습니다.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(
    prefix = "ratelimit",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class Bucket4jConfig {

  @Bean
  public RateLimiter rateLimiter(
      BucketResolver bucketResolver,
      RateLimitProperties properties,
      LogicExecutor logicExecutor,
      MeterRegistry meterRegistry) {
    log.info(
        "[Bucket4jConfig] RateLimiter: failureMode={}, keyPrefix={}",
        properties.getFailureMode(),
        properties.getKeyPrefix());
    return new Bucket4jRateLimiter(
        bucketResolver, properties.toPolicy(), logicExecutor, meterRegistry);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "threatgraph.store",
      name = "type",
      havingValue = "memory",
      matchIfMissing = true)
  public BucketResolver localBucketResolver(RateLimitProperties properties) {
    Duration idleExpiry =
        properties.toPolicy().localBucketIdleExpiry(properties.getBucketExpiration());
    log.info("[Bucket4jConfig] Local buckets: idleExpiry={}", idleExpiry);
    return new LocalBucketResolver(idleExpiry);
  }

  @Configuration
  @ConditionalOnProperty(prefix = "threatgraph.store", name = "type", havingValue = "redis")
  static class DistributedBucketConfig {

    @Bean
    public ProxyManager<String> rateLimitProxyManager(
        RedissonClient redissonClient, RateLimitProperties properties) {
      log.info(
          "[Bucket4jConfig] Initializing ProxyManager with Redisson: keyPrefix={}",
          properties.getKeyPrefix());
      Redisson redisson = (Redisson) redissonClient;
      return Bucket4jRedisson.casBasedBuilder(redisson.getCommandExecutor())
          .expirationAfterWrite(
              ExpirationAfterWriteStrategy.basedOnTimeForRefillingBucketUpToMax(
                  properties.getBucketExpiration()))
          .build();
    }

    @Bean
    public BucketResolver proxyManagerBucketResolver(ProxyManager<String> rateLimitProxyManager) {
      return new ProxyManagerBucketResolver(rateLimitProxyManager);
    }
  }
}

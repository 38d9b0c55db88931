package secops.threatgraph.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** threatgraph.store.type=redis일 때만 RedissonClient를 만듭니다. */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "threatgraph.store", name = "type", havingValue = "redis")
public class RedissonConfig {

  private final StoreProperties storeProperties;

  @Bean(destroyMethod = "shutdown")
  public RedissonClient redissonClient() {
    StoreProperties.Redis redis = storeProperties.getRedis();
    Config config = new Config();
    config
        .useSingleServer()
        .setAddress(redis.getAddress())
        .setPassword(redis.getPassword())
        .setDatabase(redis.getDatabase())
        .setTimeout((int) redis.getTimeout().toMillis())
        .setConnectTimeout((int) redis.getConnectTimeout().toMillis())
        .setRetryAttempts(3)
        .setRetryInterval(1500)
        .setConnectionPoolSize(redis.getConnectionPoolSize())
        .setConnectionMinimumIdleSize(redis.getConnectionMinimumIdleSize());

    log.info(
        "[RedissonConfig] Connecting: address={}, database={}", redis.getAddress(), redis.getDatabase());
    return Redisson.create(config);
  }
}

package secops.threatgraph.config;

import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import secops.threatgraph.core.cache.store.InMemorySharedCacheStore;
import secops.threatgraph.core.port.out.EntityStore;
import secops.threatgraph.core.port.out.SharedCacheStore;
import secops.threatgraph.core.store.InMemoryGraphStore;
import secops.threatgraph.infrastructure.cache.store.RedissonSharedCacheStore;

/**
 * 저장소 어댑터 선택
 *
 * <p>주 저장소(EntityStore/RelationshipStore/EnrichmentProvider)는 외부 협력자가 빈으로 제공합니다. 제공되지 않으면 프로세스 내
 * 저장소를 씁니다.
 */
@Slf4j
@Configuration
public class StoreConfig {

  @Bean
  @ConditionalOnProperty(
      prefix = "threatgraph.store",
      name = "type",
      havingValue = "memory",
      matchIfMissing = true)
  public SharedCacheStore inMemorySharedCacheStore(Clock clock) {
    log.info("[StoreConfig] Shared cache store: memory");
    return new InMemorySharedCacheStore(clock);
  }

  @Bean
  @ConditionalOnProperty(prefix = "threatgraph.store", name = "type", havingValue = "redis")
  public SharedCacheStore redissonSharedCacheStore(
      RedissonClient redissonClient, StoreProperties properties) {
    log.info("[StoreConfig] Shared cache store: redis, keyPrefix={}", properties.getKeyPrefix());
    return new RedissonSharedCacheStore(redissonClient, properties.getKeyPrefix());
  }

  @Bean
  @ConditionalOnMissingBean(EntityStore.class)
  public InMemoryGraphStore inMemoryGraphStore() {
    log.warn("[StoreConfig] No EntityStore bean provided, using in-process graph store");
    return new InMemoryGraphStore();
  }
}

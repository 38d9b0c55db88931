package secops.threatgraph.core.loader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import secops.threatgraph.core.cache.CacheKeys;
import secops.threatgraph.core.cache.EntityCacheManager;
import secops.threatgraph.core.cache.store.InMemorySharedCacheStore;
import secops.threatgraph.core.domain.model.GraphEntity;
import secops.threatgraph.core.port.out.CacheInvalidationPublisher;
import secops.threatgraph.core.port.out.EnrichmentProvider;
import secops.threatgraph.core.port.out.EntityStore;
import secops.threatgraph.core.port.out.RelationshipStore;
import secops.threatgraph.core.support.CoreFixtures;
import secops.threatgraph.core.support.MutableClock;

@Tag("unit")
@DisplayName("ThreatGraphLoaders 테스트")
class ThreatGraphLoadersTest {

  private static final GraphEntity T1 = GraphEntity.of("threat", "T1", "org-1");
  private static final GraphEntity T2 = GraphEntity.of("threat", "T2", "org-1");
  private static final GraphEntity IOC1 = GraphEntity.of("ioc", "I1", "org-1");

  private EntityStore entityStore;
  private RelationshipStore relationshipStore;
  private EnrichmentProvider enrichmentProvider;
  private EntityCacheManager cacheManager;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    entityStore = mock(EntityStore.class);
    relationshipStore = mock(RelationshipStore.class);
    enrichmentProvider = mock(EnrichmentProvider.class);
    meterRegistry = new SimpleMeterRegistry();
    MutableClock clock = MutableClock.startingNow();
    cacheManager =
        CoreFixtures.cacheManager(
            new InMemorySharedCacheStore(clock), CacheInvalidationPublisher.NOOP, clock, meterRegistry);
  }

  private ThreatGraphLoaders newRequest() {
    LoaderRegistry registry =
        new LoaderRegistry(LoaderSupport.direct(CoreFixtures.logicExecutor(meterRegistry), meterRegistry));
    return new ThreatGraphLoaders(
        registry,
        entityStore,
        relationshipStore,
        enrichmentProvider,
        cacheManager,
        CoreFixtures.objectMapper(),
        LoaderSettings.defaults());
  }

  @Nested
  @DisplayName("엔티티 로더")
  class EntityLoader {

    @Test
    @DisplayName("여러 요청 사이에서는 공유 캐시가 저장소 호출을 대신한다")
    void sharedCacheAcrossRequests() {
      given(entityStore.findByIds("threat", List.of("T1", "T2"))).willReturn(List.of(T1, T2));

      ThreatGraphLoaders first = newRequest();
      CompletableFuture<List<GraphEntity>> firstResult =
          first.entity("threat").loadMany(List.of("T1", "T2"));
      first.dispatchAll();

      ThreatGraphLoaders second = newRequest();
      CompletableFuture<GraphEntity> secondResult = second.entity("threat").load("T2");
      second.dispatchAll();

      assertThat(firstResult.join()).containsExactly(T1, T2);
      assertThat(secondResult.join()).isEqualTo(T2);
      verify(entityStore, times(1)).findByIds(eq("threat"), anyList());
    }

    @Test
    @DisplayName("evict 후에는 같은 요청 안에서도 다시 조회한다")
    void evictClearsRequestScope() {
      given(entityStore.findByIds("threat", List.of("T1"))).willReturn(List.of(T1));
      ThreatGraphLoaders loaders = newRequest();
      loaders.entity("threat").load("T1");
      loaders.dispatchAll();

      loaders.evict("threat", "T1");
      cacheManager.invalidate("threat", "T1");
      loaders.entity("threat").load("T1");
      loaders.dispatchAll();

      verify(entityStore, times(2)).findByIds("threat", List.of("T1"));
    }
  }

  @Nested
  @DisplayName("관계 로더")
  class RelationshipLoader {

    @Test
    @DisplayName("결과가 없는 부모는 빈 목록으로 해소된다")
    void missingParentResolvesEmpty() {
      given(relationshipStore.findByParentIds("threat", "iocs", List.of("T1", "T2")))
          .willReturn(Map.of("T1", List.of(IOC1)));
      ThreatGraphLoaders loaders = newRequest();

      CompletableFuture<List<GraphEntity>> t1 = loaders.relationship("threat", "iocs").load("T1");
      CompletableFuture<List<GraphEntity>> t2 = loaders.relationship("threat", "iocs").load("T2");
      loaders.dispatchAll();

      assertThat(t1.join()).containsExactly(IOC1);
      assertThat(t2.join()).isEmpty();
    }

    @Test
    @DisplayName("관계 목록은 rel 키로 공유 캐시에 저장된다")
    void relationshipCachedUnderRelKey() {
      given(relationshipStore.findByParentIds("threat", "iocs", List.of("T1")))
          .willReturn(Map.of("T1", List.of(IOC1)));
      ThreatGraphLoaders loaders = newRequest();
      loaders.relationship("threat", "iocs").load("T1");
      loaders.dispatchAll();

      assertThat(cacheManager.get(CacheKeys.relationship("threat", "T1", "iocs"), List.class))
          .isPresent();
    }

    @Test
    @DisplayName("카운트 로더는 결과가 없으면 0")
    void countDefaultsToZero() {
      given(relationshipStore.countByParentIds("actor", "threats", List.of("A1", "A2")))
          .willReturn(Map.of("A1", 3L));
      ThreatGraphLoaders loaders = newRequest();

      CompletableFuture<Long> a1 = loaders.count("actor", "threats").load("A1");
      CompletableFuture<Long> a2 = loaders.count("actor", "threats").load("A2");
      loaders.dispatchAll();

      assertThat(a1.join()).isEqualTo(3L);
      assertThat(a2.join()).isZero();
    }
  }

  @Test
  @DisplayName("보강 로더는 실패한 키만 null로 만들고 나머지 키는 해소한다")
  void enrichmentFailureIsPerKey() throws Exception {
    GraphEntity enriched = GraphEntity.of("enrichment", "I2", "org-1");
    given(enrichmentProvider.enrichIoc("I1")).willThrow(new IllegalStateException("vendor 503"));
    given(enrichmentProvider.enrichIoc("I2")).willReturn(enriched);
    ThreatGraphLoaders loaders = newRequest();

    CompletableFuture<GraphEntity> failed = loaders.iocEnrichment().load("I1");
    CompletableFuture<GraphEntity> ok = loaders.iocEnrichment().load("I2");
    loaders.dispatchAll();

    assertThat(failed.join()).isNull();
    assertThat(ok.join()).isEqualTo(enriched);
    verify(entityStore, never()).findByIds(eq("ioc"), anyList());
  }
}

package secops.threatgraph.core.cache;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import secops.threatgraph.core.domain.model.CacheEntry;
import secops.threatgraph.core.domain.model.EntityKey;
import secops.threatgraph.core.port.out.CacheInvalidationEvent;
import secops.threatgraph.core.port.out.CacheInvalidationPublisher;
import secops.threatgraph.core.port.out.SharedCacheStore;
import secops.threatgraph.error.exception.CacheUnavailableException;
import secops.threatgraph.global.executor.LogicExecutor;
import secops.threatgraph.global.executor.TaskContext;

/**
 * 2층 엔티티 캐시 (L1: Caffeine near-cache, L2: 공유 저장소)
 *
 * <ul>
 *   <li>조회: L1 → L2, L2 적중 시 L1 backfill
 *   <li>저장: L2 → L1 (L2 성공 시에만 L1 저장)
 *   <li>무효화: L2 → L1 → 원격 인스턴스 L1 무효화 이벤트
 *   <li>L2 장애는 치명적이지 않습니다. 경고 로그와 {@code cache.l2.failure} 카운터만 남기고 미스로 처리합니다.
 * </ul>
 *
 * <p>연쇄 무효화는 패턴 삭제 기반의 최선 노력(eventually consistent) 동작입니다. 분산 락을 쓰지 않으므로 TTL 만료나 다음 무효화 전까지 파생
 * 엔트리가 잠시 남을 수 있습니다.
 */
@Slf4j
public class EntityCacheManager {

  private static final String TAG_PREFIX = "tag:";

  private final SharedCacheStore store;
  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;
  private final CacheInvalidationPublisher invalidationPublisher;
  private final CascadeRules cascadeRules;
  private final CacheSettings settings;
  private final Clock clock;
  private final Cache<String, CacheEntry> l1;

  private final Counter l1HitCounter;
  private final Counter l2HitCounter;
  private final Counter missCounter;
  private final Counter l2FailureCounter;
  private final Counter invalidationPublishCounter;

  public EntityCacheManager(
      SharedCacheStore store,
      ObjectMapper objectMapper,
      LogicExecutor executor,
      CacheInvalidationPublisher invalidationPublisher,
      CascadeRules cascadeRules,
      CacheSettings settings,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.store = store;
    this.objectMapper = objectMapper;
    this.executor = executor;
    this.invalidationPublisher = invalidationPublisher;
    this.cascadeRules = cascadeRules;
    this.settings = settings;
    this.clock = clock;
    this.l1 =
        Caffeine.newBuilder()
            .maximumSize(settings.l1Enabled() ? settings.l1MaxSize() : 0)
            .expireAfterWrite(settings.l1MaxTtl())
            .build();

    this.l1HitCounter = Counter.builder("cache.hit").tag("layer", "L1").register(meterRegistry);
    this.l2HitCounter = Counter.builder("cache.hit").tag("layer", "L2").register(meterRegistry);
    this.missCounter = Counter.builder("cache.miss").register(meterRegistry);
    this.l2FailureCounter = Counter.builder("cache.l2.failure").register(meterRegistry);
    this.invalidationPublishCounter =
        Counter.builder("cache.invalidation.publish").register(meterRegistry);
  }

  // ==================== 조회 ====================

  public <T> Optional<T> get(EntityKey key, Class<T> type) {
    return get(key, objectMapper.constructType(type));
  }

  public <T> Optional<T> get(EntityKey key, JavaType type) {
    return getRaw(key.toCacheKey()).flatMap(json -> deserialize(key.toCacheKey(), json, type));
  }

  /**
   * 다건 조회
   *
   * @return 적중한 키만 담은 맵 (요청 순서 유지)
   */
  public <T> Map<EntityKey, T> mget(Collection<EntityKey> keys, JavaType type) {
    Map<EntityKey, T> result = new LinkedHashMap<>();
    List<EntityKey> l1Misses = new ArrayList<>();
    Instant now = clock.instant();

    for (EntityKey key : keys) {
      CacheEntry entry = liveL1(key.toCacheKey(), now);
      if (entry == null) {
        l1Misses.add(key);
        continue;
      }
      l1HitCounter.increment();
      this.<T>deserialize(key.toCacheKey(), entry.serializedValue(), type)
          .ifPresent(value -> result.put(key, value));
    }
    if (l1Misses.isEmpty()) {
      return orderLike(keys, result);
    }

    List<String> rawKeys = l1Misses.stream().map(EntityKey::toCacheKey).toList();
    Map<String, String> found =
        l2Call("mget", rawKeys.get(0), () -> store.mget(rawKeys), Map.<String, String>of());
    for (EntityKey key : l1Misses) {
      String json = found.get(key.toCacheKey());
      if (json == null) {
        missCounter.increment();
        continue;
      }
      l2HitCounter.increment();
      backfill(key.toCacheKey(), json);
      this.<T>deserialize(key.toCacheKey(), json, type).ifPresent(value -> result.put(key, value));
    }
    return orderLike(keys, result);
  }

  // ==================== 저장 ====================

  public void set(EntityKey key, Object value) {
    set(key, value, null);
  }

  /**
   * @param ttlOverride null이면 유형별 기본 TTL
   */
  public void set(EntityKey key, Object value, Duration ttlOverride) {
    Duration ttl = ttlOverride != null ? ttlOverride : settings.ttlFor(key.entityType());
    serialize(key.toCacheKey(), value).ifPresent(json -> putRaw(key.toCacheKey(), json, ttl));
  }

  /** 파이프라인 한 번으로 저장합니다. 키마다 유형별 TTL이 다르면 TTL별로 나누어 보냅니다. */
  public void mset(Map<EntityKey, ?> values, Duration ttlOverride) {
    if (values.isEmpty()) {
      return;
    }
    Map<Duration, Map<String, String>> byTtl = new LinkedHashMap<>();
    values.forEach(
        (key, value) -> {
          Duration ttl = ttlOverride != null ? ttlOverride : settings.ttlFor(key.entityType());
          serialize(key.toCacheKey(), value)
              .ifPresent(
                  json ->
                      byTtl.computeIfAbsent(ttl, t -> new LinkedHashMap<>()).put(key.toCacheKey(), json));
        });

    byTtl.forEach(
        (ttl, entries) -> {
          boolean l2Success =
              l2Call(
                  "mset",
                  entries.keySet().iterator().next(),
                  () -> {
                    store.mset(entries, ttl);
                    return true;
                  },
                  false);
          if (l2Success) {
            entries.forEach((rawKey, json) -> putL1(rawKey, json, ttl));
          }
        });
    publish(CacheInvalidationEvent.evict(settings.instanceId(), keysOf(values.keySet())));
  }

  // ==================== 무효화 ====================

  public void delete(EntityKey key) {
    evictKeys(List.of(key.toCacheKey()));
  }

  /**
   * 직접 키와 유형별로 선언된 파생 캐시 패턴을 함께 삭제합니다.
   *
   * @return 공유 저장소에서 삭제된 키 수 (저장소 장애 시 0)
   */
  public long invalidate(String entityType, String id) {
    String directKey = EntityKey.of(entityType, id).toCacheKey();
    List<String> patterns = cascadeRules.patternsFor(entityType, id);
    long removed = evictKeys(List.of(directKey)) + evictPatterns(patterns);
    log.debug(
        "[EntityCache] Invalidated: key={}, patterns={}, removed={}", directKey, patterns, removed);
    return removed;
  }

  /** 조직 범위 분석/대시보드 캐시와 전체 검색 캐시를 삭제합니다. */
  public long invalidateOrganization(String organizationId) {
    return evictPatterns(CascadeRules.organizationPatterns(organizationId));
  }

  public void tag(EntityKey key, Collection<String> tags) {
    String rawKey = key.toCacheKey();
    l2Call(
        "tag",
        rawKey,
        () -> {
          SharedCacheStore.StorePipeline pipeline = store.pipeline();
          tags.forEach(tag -> pipeline.addToSet(TAG_PREFIX + tag, rawKey, settings.tagTtl()));
          pipeline.execute();
          return true;
        },
        false);
  }

  /** 태그에 속한 모든 키와 태그 집합 자체를 삭제합니다. */
  public long invalidateByTag(String tag) {
    String tagKey = TAG_PREFIX + tag;
    Set<String> members = l2Call("members", tagKey, () -> store.members(tagKey), Set.<String>of());
    List<String> targets = new ArrayList<>(members);
    targets.add(tagKey);
    long removed = evictKeys(targets);
    log.debug("[EntityCache] Invalidated by tag: tag={}, members={}", tag, members.size());
    return removed;
  }

  /** L1 전체 비우기 (로컬 + 원격 인스턴스) */
  public void clearNearCache() {
    l1.invalidateAll();
    publish(CacheInvalidationEvent.clearAll(settings.instanceId()));
  }

  /**
   * 원격 인스턴스가 보낸 L1 무효화 이벤트 처리
   *
   * <p>자기 자신이 발행한 이벤트는 무시합니다.
   */
  public void onRemoteInvalidation(CacheInvalidationEvent event) {
    if (settings.instanceId().equals(event.sourceInstanceId())) {
      return;
    }
    switch (event.type()) {
      case EVICT -> l1.invalidateAll(event.targets());
      case EVICT_PATTERN -> event.targets().forEach(this::evictL1Pattern);
      case CLEAR_ALL -> l1.invalidateAll();
    }
  }

  // ==================== 상태 ====================

  public boolean healthCheck() {
    return l2Call("ping", "-", store::ping, false);
  }

  public long nearCacheSize() {
    l1.cleanUp();
    return l1.estimatedSize();
  }

  // ==================== 내부 ====================

  private Optional<String> getRaw(String rawKey) {
    CacheEntry entry = liveL1(rawKey, clock.instant());
    if (entry != null) {
      l1HitCounter.increment();
      return Optional.of(entry.serializedValue());
    }
    Optional<String> fromL2 = l2Call("get", rawKey, () -> store.get(rawKey), Optional.empty());
    if (fromL2.isPresent()) {
      l2HitCounter.increment();
      backfill(rawKey, fromL2.get());
    } else {
      missCounter.increment();
    }
    return fromL2;
  }

  private void putRaw(String rawKey, String json, Duration ttl) {
    boolean l2Success =
        l2Call(
            "set",
            rawKey,
            () -> {
              store.set(rawKey, json, ttl);
              return true;
            },
            false);
    if (!l2Success) {
      log.warn("[EntityCache] L2 set failed, skipping L1 for consistency: key={}", rawKey);
      return;
    }
    putL1(rawKey, json, ttl);
    publish(CacheInvalidationEvent.evict(settings.instanceId(), List.of(rawKey)));
  }

  private long evictKeys(List<String> rawKeys) {
    long removed = l2Call("delete", rawKeys.get(0), () -> store.delete(rawKeys), 0L);
    l1.invalidateAll(rawKeys);
    publish(CacheInvalidationEvent.evict(settings.instanceId(), rawKeys));
    return removed;
  }

  private long evictPatterns(List<String> patterns) {
    if (patterns.isEmpty()) {
      return 0;
    }
    long removed = 0;
    for (String pattern : patterns) {
      removed += l2Call("deleteByPattern", pattern, () -> store.deleteByPattern(pattern), 0L);
      evictL1Pattern(pattern);
    }
    publish(CacheInvalidationEvent.evictPattern(settings.instanceId(), patterns));
    return removed;
  }

  private void evictL1Pattern(String pattern) {
    l1.asMap().keySet().removeIf(rawKey -> KeyPatterns.matches(pattern, rawKey));
  }

  private CacheEntry liveL1(String rawKey, Instant now) {
    CacheEntry entry = l1.getIfPresent(rawKey);
    if (entry == null) {
      return null;
    }
    if (entry.isExpired(now)) {
      l1.invalidate(rawKey);
      return null;
    }
    return entry;
  }

  /**
   * L2 적중 값을 L1에 채웁니다. L1 만료는 L2의 남은 수명을 넘지 않습니다.
   *
   * <p>남은 수명을 알 수 없으면(키 소멸, 저장소 장애) 채우지 않습니다.
   */
  private void backfill(String rawKey, String json) {
    if (!settings.l1Enabled()) {
      return;
    }
    Optional<Duration> remaining =
        l2Call("remainingTtl", rawKey, () -> store.remainingTtl(rawKey), Optional.empty());
    remaining
        .filter(ttl -> ttl.compareTo(Duration.ZERO) > 0)
        .ifPresent(ttl -> putL1(rawKey, json, ttl));
  }

  private void putL1(String rawKey, String json, Duration ttl) {
    if (!settings.l1Enabled()) {
      return;
    }
    Duration l1Ttl = ttl.compareTo(settings.l1MaxTtl()) < 0 ? ttl : settings.l1MaxTtl();
    l1.put(rawKey, CacheEntry.of(rawKey, json, clock.instant().plus(l1Ttl)));
  }

  private void publish(CacheInvalidationEvent event) {
    if (!settings.l1Enabled()) {
      return;
    }
    executor.executeOrCatch(
        () -> {
          invalidationPublisher.publish(event);
          invalidationPublishCounter.increment();
          return null;
        },
        e -> {
          log.warn("[EntityCache] Invalidation broadcast failed: type={}, cause={}", event.type(), e.toString());
          return null;
        },
        TaskContext.of("EntityCache", "publishInvalidation", event.type().name()));
  }

  /** L2 호출 공통 처리: 실패 시 CacheUnavailable 경고 후 fallback 반환 */
  private <R> R l2Call(String operation, String key, L2Operation<R> call, R fallback) {
    TaskContext context = TaskContext.of("EntityCache", operation, key);
    return executor.executeOrCatch(call::run, e -> degrade(operation, key, e, fallback), context);
  }

  private <R> R degrade(String operation, String key, Throwable cause, R fallback) {
    l2FailureCounter.increment();
    CacheUnavailableException unavailable = new CacheUnavailableException(operation, cause);
    log.warn(
        "[EntityCache] {} Degrading to backing store: key={}, cause={}",
        unavailable.getMessage(),
        key,
        cause.toString());
    return fallback;
  }

  private <T> Optional<T> deserialize(String rawKey, String json, JavaType type) {
    return executor.executeOrCatch(
        () -> Optional.ofNullable(objectMapper.<T>readValue(json, type)),
        e -> {
          log.warn("[EntityCache] Corrupted entry ignored: key={}, cause={}", rawKey, e.toString());
          return Optional.empty();
        },
        TaskContext.of("EntityCache", "deserialize", rawKey));
  }

  private Optional<String> serialize(String rawKey, Object value) {
    return executor.executeOrCatch(
        () -> Optional.of(objectMapper.writeValueAsString(value)),
        e -> {
          log.warn("[EntityCache] Value not serializable, skipped: key={}, cause={}", rawKey, e.toString());
          return Optional.empty();
        },
        TaskContext.of("EntityCache", "serialize", rawKey));
  }

  private static List<String> keysOf(Collection<EntityKey> keys) {
    return keys.stream().map(EntityKey::toCacheKey).toList();
  }

  private static <T> Map<EntityKey, T> orderLike(Collection<EntityKey> keys, Map<EntityKey, T> found) {
    Map<EntityKey, T> ordered = new LinkedHashMap<>();
    for (EntityKey key : new LinkedHashSet<>(keys)) {
      T value = found.get(key);
      if (value != null) {
        ordered.put(key, value);
      }
    }
    return ordered;
  }

  @FunctionalInterface
  private interface L2Operation<R> {
    R run() throws Exception;
  }
}

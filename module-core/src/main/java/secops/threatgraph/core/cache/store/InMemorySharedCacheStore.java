package secops.threatgraph.core.cache.store;

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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import secops.threatgraph.core.cache.KeyPatterns;
import secops.threatgraph.core.domain.model.CacheEntry;
import secops.threatgraph.core.port.out.SharedCacheStore;

/**
 * 단일 프로세스용 SharedCacheStore
 *
 * <p>{@code threatgraph.store.type=memory} 구성과 테스트에서 사용합니다. 만료는 주입된 {@link Clock} 기준으로 판정합니다.
 * 만료된 값/카운터/집합은 조회 시점, {@link #keys} 스캔, 그리고 쓰기 {@value #SWEEP_INTERVAL}회마다 도는 정리에서 제거됩니다.
 */
public class InMemorySharedCacheStore implements SharedCacheStore {

  static final int SWEEP_INTERVAL = 1024;

  private final Clock clock;
  private final AtomicInteger writesSinceSweep = new AtomicInteger();
  private final Map<String, CacheEntry> values = new ConcurrentHashMap<>();
  private final Map<String, Counter> counters = new ConcurrentHashMap<>();
  private final Map<String, MemberSet> sets = new ConcurrentHashMap<>();

  public InMemorySharedCacheStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Optional<String> get(String key) {
    return live(key).map(CacheEntry::serializedValue);
  }

  @Override
  public Optional<Duration> remainingTtl(String key) {
    return live(key)
        .map(
            entry ->
                Instant.MAX.equals(entry.expiresAt())
                    ? NO_EXPIRY
                    : Duration.between(clock.instant(), entry.expiresAt()));
  }

  @Override
  public Map<String, String> mget(Collection<String> keys) {
    Map<String, String> found = new LinkedHashMap<>();
    for (String key : keys) {
      live(key).ifPresent(entry -> found.put(key, entry.serializedValue()));
    }
    return found;
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    values.put(key, CacheEntry.of(key, value, expiry(ttl)));
    afterWrite();
  }

  @Override
  public long delete(Collection<String> keys) {
    long removed = 0;
    for (String key : keys) {
      boolean hit =
          values.remove(key) != null | counters.remove(key) != null | sets.remove(key) != null;
      if (hit) {
        removed++;
      }
    }
    return removed;
  }

  /** 스캔하면서 만난 만료 항목은 함께 제거합니다. */
  @Override
  public Set<String> keys(String pattern) {
    purgeExpired();
    Set<String> matched = new LinkedHashSet<>();
    for (String key : values.keySet()) {
      if (KeyPatterns.matches(pattern, key)) {
        matched.add(key);
      }
    }
    for (String key : sets.keySet()) {
      if (KeyPatterns.matches(pattern, key)) {
        matched.add(key);
      }
    }
    return matched;
  }

  /**
   * 만료된 값, 카운터, 집합을 모두 제거합니다.
   *
   * @return 제거한 항목 수
   */
  public int purgeExpired() {
    Instant now = clock.instant();
    int removed = 0;
    for (Map.Entry<String, CacheEntry> entry : values.entrySet()) {
      if (entry.getValue().isExpired(now) && values.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }
    for (Map.Entry<String, Counter> entry : counters.entrySet()) {
      if (entry.getValue().isExpired(now) && counters.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }
    for (Map.Entry<String, MemberSet> entry : sets.entrySet()) {
      if (entry.getValue().isExpired(now) && sets.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }
    writesSinceSweep.set(0);
    return removed;
  }

  /** 만료 여부와 무관하게 보관 중인 항목 수 */
  public int storedEntries() {
    return values.size() + counters.size() + sets.size();
  }

  @Override
  public long incr(String key, long delta, Duration ttlIfNew) {
    Instant now = clock.instant();
    Counter counter =
        counters.compute(
            key,
            (k, existing) -> {
              if (existing == null || existing.isExpired(now)) {
                return new Counter(delta, expiry(ttlIfNew));
              }
              return new Counter(existing.value() + delta, existing.expiresAt());
            });
    afterWrite();
    return counter.value();
  }

  @Override
  public void addToSet(String key, Collection<String> members, Duration ttl) {
    Instant now = clock.instant();
    sets.compute(
        key,
        (k, existing) -> {
          MemberSet target =
              existing == null || existing.isExpired(now) ? new MemberSet() : existing;
          target.members.addAll(members);
          target.expiresAt = expiry(ttl);
          return target;
        });
    afterWrite();
  }

  @Override
  public Set<String> members(String key) {
    MemberSet set = sets.get(key);
    if (set == null || set.isExpired(clock.instant())) {
      return Set.of();
    }
    return Set.copyOf(set.members);
  }

  @Override
  public StorePipeline pipeline() {
    return new MemoryPipeline();
  }

  @Override
  public boolean ping() {
    return true;
  }

  private Optional<CacheEntry> live(String key) {
    CacheEntry entry = values.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpired(clock.instant())) {
      values.remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(entry);
  }

  private void afterWrite() {
    if (writesSinceSweep.incrementAndGet() >= SWEEP_INTERVAL) {
      purgeExpired();
    }
  }

  private Instant expiry(Duration ttl) {
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      return Instant.MAX;
    }
    return clock.instant().plus(ttl);
  }

  private record Counter(long value, Instant expiresAt) {
    boolean isExpired(Instant now) {
      return !now.isBefore(expiresAt);
    }
  }

  private static final class MemberSet {
    private final Set<String> members = ConcurrentHashMap.newKeySet();
    private volatile Instant expiresAt = Instant.MAX;

    boolean isExpired(Instant now) {
      return !now.isBefore(expiresAt);
    }
  }

  private final class MemoryPipeline implements StorePipeline {
    private final List<Consumer<InMemorySharedCacheStore>> commands = new ArrayList<>();

    @Override
    public StorePipeline set(String key, String value, Duration ttl) {
      commands.add(store -> store.set(key, value, ttl));
      return this;
    }

    @Override
    public StorePipeline delete(String key) {
      commands.add(store -> store.delete(List.of(key)));
      return this;
    }

    @Override
    public StorePipeline addToSet(String key, String member, Duration ttl) {
      commands.add(store -> store.addToSet(key, List.of(member), ttl));
      return this;
    }

    @Override
    public void execute() {
      commands.forEach(command -> command.accept(InMemorySharedCacheStore.this));
      commands.clear();
    }
  }
}

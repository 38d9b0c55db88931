package secops.threatgraph.infrastructure.cache.store;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.BatchOptions;
import org.redisson.api.RBatch;
import org.redisson.api.RScript;
import org.redisson.api.RSet;
import org.redisson.api.RSetAsync;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import secops.threatgraph.core.port.out.SharedCacheStore;

/**
 * Redisson 기반 공유 캐시 저장소
 *
 * <p>모든 값은 {@link StringCodec}으로 저장하며 키 앞에 keyPrefix를 붙입니다. 실패는 Redisson 예외 그대로 전파하고, 장애 흡수는
 * 캐시 매니저가 담당합니다.
 *
 * <h3>원자성</h3>
 *
 * <ul>
 *   <li>incr: Lua 스크립트로 INCRBY와 최초 생성 시 PEXPIRE를 한 번에 실행
 *   <li>mset/pipeline: {@link RBatch}로 한 번의 왕복
 * </ul>
 */
@Slf4j
public class RedissonSharedCacheStore implements SharedCacheStore {

  static final String INCR_WITH_TTL =
      "local v = redis.call('INCRBY', KEYS[1], ARGV[1]) "
          + "if v == tonumber(ARGV[1]) and tonumber(ARGV[2]) > 0 then "
          + "redis.call('PEXPIRE', KEYS[1], ARGV[2]) end "
          + "return v";

  static final String PING = "return redis.call('PING')";

  private final RedissonClient redissonClient;
  private final String keyPrefix;

  public RedissonSharedCacheStore(RedissonClient redissonClient, String keyPrefix) {
    this.redissonClient = redissonClient;
    this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(
        redissonClient.<String>getBucket(full(key), StringCodec.INSTANCE).get());
  }

  /** PTTL: -2는 키 없음, -1은 만료 없음 */
  @Override
  public Optional<Duration> remainingTtl(String key) {
    long millis = redissonClient.getBucket(full(key), StringCodec.INSTANCE).remainTimeToLive();
    if (millis == -2) {
      return Optional.empty();
    }
    return Optional.of(millis < 0 ? NO_EXPIRY : Duration.ofMillis(millis));
  }

  @Override
  public Map<String, String> mget(Collection<String> keys) {
    if (keys.isEmpty()) {
      return Map.of();
    }
    String[] fullKeys = keys.stream().map(this::full).toArray(String[]::new);
    Map<String, String> raw = redissonClient.getBuckets(StringCodec.INSTANCE).get(fullKeys);

    Map<String, String> found = new HashMap<>(raw.size());
    raw.forEach((fullKey, value) -> found.put(strip(fullKey), value));
    return SharedCacheStore.orderedSubset(keys, found);
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    redissonClient
        .<String>getBucket(full(key), StringCodec.INSTANCE)
        .set(value, ttl.toMillis(), TimeUnit.MILLISECONDS);
  }

  @Override
  public long delete(Collection<String> keys) {
    if (keys.isEmpty()) {
      return 0;
    }
    return redissonClient.getKeys().delete(keys.stream().map(this::full).toArray(String[]::new));
  }

  /** SCAN 기반 패턴 조회. 반환 키에서는 keyPrefix를 제거합니다. */
  @Override
  public Set<String> keys(String pattern) {
    Set<String> matched = new HashSet<>();
    for (String fullKey : redissonClient.getKeys().getKeysByPattern(full(pattern))) {
      matched.add(strip(fullKey));
    }
    return matched;
  }

  @Override
  public long incr(String key, long delta, Duration ttlIfNew) {
    RScript script = redissonClient.getScript(StringCodec.INSTANCE);
    Long result =
        script.eval(
            RScript.Mode.READ_WRITE,
            INCR_WITH_TTL,
            RScript.ReturnType.INTEGER,
            List.of(full(key)),
            String.valueOf(delta),
            String.valueOf(ttlIfNew == null ? 0 : ttlIfNew.toMillis()));
    return result == null ? 0 : result;
  }

  @Override
  public void addToSet(String key, Collection<String> members, Duration ttl) {
    if (members.isEmpty()) {
      return;
    }
    RBatch batch = redissonClient.createBatch(BatchOptions.defaults());
    RSetAsync<String> set = batch.getSet(full(key), StringCodec.INSTANCE);
    set.addAllAsync(members);
    set.expireAsync(ttl);
    batch.execute();
  }

  @Override
  public Set<String> members(String key) {
    RSet<String> set = redissonClient.getSet(full(key), StringCodec.INSTANCE);
    return set.readAll();
  }

  @Override
  public StorePipeline pipeline() {
    return new BatchPipeline();
  }

  @Override
  public boolean ping() {
    String reply =
        redissonClient
            .getScript(StringCodec.INSTANCE)
            .eval(RScript.Mode.READ_ONLY, PING, RScript.ReturnType.STATUS);
    return "PONG".equalsIgnoreCase(reply);
  }

  private String full(String key) {
    return keyPrefix + key;
  }

  private String strip(String fullKey) {
    return fullKey.startsWith(keyPrefix) ? fullKey.substring(keyPrefix.length()) : fullKey;
  }

  /** execute 시점에 {@link RBatch}를 만들어 모아 둔 명령을 한 번에 보냅니다. */
  private final class BatchPipeline implements StorePipeline {

    private final List<Consumer<RBatch>> commands = new ArrayList<>();

    @Override
    public StorePipeline set(String key, String value, Duration ttl) {
      commands.add(
          batch ->
              batch
                  .<String>getBucket(full(key), StringCodec.INSTANCE)
                  .setAsync(value, ttl.toMillis(), TimeUnit.MILLISECONDS));
      return this;
    }

    @Override
    public StorePipeline delete(String key) {
      commands.add(batch -> batch.getKeys().deleteAsync(full(key)));
      return this;
    }

    @Override
    public StorePipeline addToSet(String key, String member, Duration ttl) {
      commands.add(
          batch -> {
            RSetAsync<String> set = batch.getSet(full(key), StringCodec.INSTANCE);
            set.addAsync(member);
            set.expireAsync(ttl);
          });
      return this;
    }

    @Override
    public void execute() {
      if (commands.isEmpty()) {
        return;
      }
      RBatch batch = redissonClient.createBatch(BatchOptions.defaults());
      commands.forEach(command -> command.accept(batch));
      batch.execute();
      log.debug("[RedissonSharedCacheStore] Pipeline executed: commands={}", commands.size());
    }
  }
}

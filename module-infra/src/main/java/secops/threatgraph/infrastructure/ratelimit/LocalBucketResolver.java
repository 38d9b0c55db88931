package secops.threatgraph.infrastructure.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.BucketConfiguration;
import io.github.bucket4j.TimeMeter;
import io.github.bucket4j.local.LocalBucketBuilder;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * 프로세스 내 버킷 (store.type=memory)
 *
 * <p>인스턴스 간 공유되지 않으므로 단일 인스턴스 구성에서만 씁니다. idleExpiry 동안 접근이 없는 버킷은 제거됩니다. idleExpiry는 버킷이 가득
 * 찰 때까지 걸리는 시간보다 길어야 제거 후 새 버킷이 한도를 되살리지 않습니다.
 *
 * <p>Caffeine 만료 판정도 같은 {@link TimeMeter}를 따르므로 테스트에서 시간을 함께 제어할 수 있습니다.
 */
public class LocalBucketResolver implements BucketResolver {

  private final Cache<String, Bucket> buckets;
  private final TimeMeter timeMeter;

  public LocalBucketResolver(Duration idleExpiry) {
    this(TimeMeter.SYSTEM_MILLISECONDS, idleExpiry);
  }

  public LocalBucketResolver(TimeMeter timeMeter, Duration idleExpiry) {
    this.timeMeter = timeMeter;
    this.buckets =
        Caffeine.newBuilder()
            .expireAfterAccess(idleExpiry)
            .ticker(timeMeter::currentTimeNanos)
            .build();
  }

  @Override
  public Bucket resolve(String key, Supplier<BucketConfiguration> configuration) {
    return buckets.get(key, k -> build(configuration.get()));
  }

  private Bucket build(BucketConfiguration configuration) {
    LocalBucketBuilder builder = Bucket.builder().withCustomTimePrecision(timeMeter);
    for (Bandwidth bandwidth : configuration.getBandwidths()) {
      builder.addLimit(bandwidth);
    }
    return builder.build();
  }

  public long size() {
    buckets.cleanUp();
    return buckets.estimatedSize();
  }
}

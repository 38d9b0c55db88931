package secops.threatgraph.infrastructure.ratelimit;

import io.github.bucket4j.Bucket;
import io.github.bucket4j.BucketConfiguration;
import io.github.bucket4j.distributed.proxy.ProxyManager;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;

/** Redisson CAS 기반 분산 버킷. 여러 인스턴스가 같은 키의 토큰을 원자적으로 나눠 씁니다. */
@RequiredArgsConstructor
public class ProxyManagerBucketResolver implements BucketResolver {

  private final ProxyManager<String> proxyManager;

  @Override
  public Bucket resolve(String key, Supplier<BucketConfiguration> configuration) {
    return proxyManager.builder().build(key, configuration);
  }
}

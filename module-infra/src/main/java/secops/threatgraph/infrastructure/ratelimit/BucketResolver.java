package secops.threatgraph.infrastructure.ratelimit;

import io.github.bucket4j.Bucket;
import io.github.bucket4j.BucketConfiguration;
import java.util.function.Supplier;

/** 키에 해당하는 버킷을 찾거나 설정으로 새로 만듭니다. */
public interface BucketResolver {

  Bucket resolve(String key, Supplier<BucketConfiguration> configuration);
}

package secops.threatgraph.infrastructure.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import io.github.bucket4j.TimeMeter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import secops.threatgraph.core.domain.model.OperationClass;
import secops.threatgraph.core.port.out.ConsumeResult;
import secops.threatgraph.global.executor.DefaultLogicExecutor;

@Tag("unit")
@DisplayName("Bucket4jRateLimiter 테스트")
class Bucket4jRateLimiterTest {

  private static final Duration WINDOW = Duration.ofSeconds(60);

  private ManualTimeMeter timeMeter;
  private SimpleMeterRegistry meterRegistry;
  private Bucket4jRateLimiter rateLimiter;

  @BeforeEach
  void setUp() {
    timeMeter = new ManualTimeMeter();
    meterRegistry = new SimpleMeterRegistry();
    RateLimitPolicy policy =
        new RateLimitPolicy(
            true,
            "{ratelimit}",
            Map.of(
                OperationClass.STANDARD_QUERY, BucketLimit.perWindow(5, WINDOW),
                OperationClass.QUERY_COMPLEXITY, BucketLimit.perWindow(10_000, WINDOW)));
    rateLimiter = limiter(new LocalBucketResolver(timeMeter, Duration.ofMinutes(10)), policy);
  }

  private Bucket4jRateLimiter limiter(BucketResolver resolver, RateLimitPolicy policy) {
    return new Bucket4jRateLimiter(
        resolver, policy, new DefaultLogicExecutor(meterRegistry), meterRegistry);
  }

  @Nested
  @DisplayName("토큰 소비")
  class Consume {

    @Test
    @DisplayName("창 안에서 6번째 요청은 거부되고 창이 지나면 다시 허용된다")
    void sixthRequestDeniedUntilWindowPasses() {
      for (int i = 0; i < 5; i++) {
        assertThat(rateLimiter.tryConsume(OperationClass.STANDARD_QUERY, "user-1", 1).allowed())
            .isTrue();
      }

      ConsumeResult sixth = rateLimiter.tryConsume(OperationClass.STANDARD_QUERY, "user-1", 1);
      assertThat(sixth.allowed()).isFalse();
      assertThat(sixth.retryAfterSeconds()).isBetween(1L, 60L);

      timeMeter.advance(WINDOW);

      ConsumeResult afterWindow = rateLimiter.tryConsume(OperationClass.STANDARD_QUERY, "user-1", 1);
      assertThat(afterWindow.allowed()).isTrue();
      assertThat(afterWindow.remainingTokens()).isEqualTo(4);
    }

    @Test
    @DisplayName("주체마다 버킷이 분리된다")
    void bucketsArePerPrincipal() {
      for (int i = 0; i < 5; i++) {
        rateLimiter.tryConsume(OperationClass.STANDARD_QUERY, "user-1", 1);
      }

      assertThat(rateLimiter.tryConsume(OperationClass.STANDARD_QUERY, "user-2", 1).allowed())
          .isTrue();
    }

    @Test
    @DisplayName("복잡도 예산은 점수만큼 차감된다")
    void complexityBudgetConsumesScore() {
      assertThat(rateLimiter.tryConsume(OperationClass.QUERY_COMPLEXITY, "user-1", 6000).allowed())
          .isTrue();

      ConsumeResult second = rateLimiter.tryConsume(OperationClass.QUERY_COMPLEXITY, "user-1", 6000);

      assertThat(second.allowed()).isFalse();
      assertThat(second.remainingTokens()).isEqualTo(4000);
    }

    @Test
    @DisplayName("한도가 없는 작업 분류는 제한하지 않는다")
    void unlimitedOperation() {
      ConsumeResult result = rateLimiter.tryConsume(OperationClass.BULK_IMPORT, "user-1", 1);

      assertThat(result.allowed()).isTrue();
      assertThat(result.isFailOpen()).isFalse();
    }

    @Test
    @DisplayName("소비 결과를 메트릭으로 남긴다")
    void recordsMetrics() {
      for (int i = 0; i < 6; i++) {
        rateLimiter.tryConsume(OperationClass.STANDARD_QUERY, "user-1", 1);
      }

      assertThat(
              meterRegistry
                  .get("ratelimit.consume")
                  .tag("operation", "standard-query")
                  .tag("result", "denied")
                  .counter()
                  .count())
          .isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("저장소 장애")
  class StoreFailure {

    private BucketResolver failingResolver() {
      BucketResolver resolver = mock(BucketResolver.class);
      given(resolver.resolve(anyString(), any())).willThrow(new IllegalStateException("redis down"));
      return resolver;
    }

    @Test
    @DisplayName("fail-open이면 허용하고 메트릭을 남긴다")
    void failOpen() {
      Bucket4jRateLimiter limiter = limiter(failingResolver(), RateLimitPolicy.defaults());

      ConsumeResult result = limiter.tryConsume(OperationClass.STANDARD_QUERY, "user-1", 1);

      assertThat(result.isFailOpen()).isTrue();
      assertThat(meterRegistry.get("ratelimit.failopen").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("fail-close면 60초 후 재시도로 거부한다")
    void failClose() {
      RateLimitPolicy defaults = RateLimitPolicy.defaults();
      RateLimitPolicy failClose = new RateLimitPolicy(false, defaults.keyPrefix(), defaults.limits());
      Bucket4jRateLimiter limiter = limiter(failingResolver(), failClose);

      ConsumeResult result = limiter.tryConsume(OperationClass.STANDARD_QUERY, "user-1", 1);

      assertThat(result.allowed()).isFalse();
      assertThat(result.retryAfterSeconds()).isEqualTo(60);
    }
  }

  @Test
  @DisplayName("버킷 키는 접두사, 작업 분류, 주체 순서다")
  void fullKey() {
    assertThat(rateLimiter.buildFullKey(OperationClass.SUBSCRIPTION_OPEN, "user-1"))
        .isEqualTo("{ratelimit}:subscription-open:user-1");
  }

  @Test
  @DisplayName("로그용 키는 마지막 4자만 남긴다")
  void maskKey() {
    assertThat(Bucket4jRateLimiter.maskKey("principal-1234")).isEqualTo("****1234");
    assertThat(Bucket4jRateLimiter.maskKey("abc")).isEqualTo("****");
    assertThat(Bucket4jRateLimiter.maskKey(null)).isEqualTo("****");
  }

  static final class ManualTimeMeter implements TimeMeter {

    private final AtomicLong nanos = new AtomicLong();

    @Override
    public long currentTimeNanos() {
      return nanos.get();
    }

    @Override
    public boolean isWallClockBased() {
      return false;
    }

    void advance(Duration duration) {
      nanos.addAndGet(duration.toNanos());
    }
  }
}

package secops.threatgraph.infrastructure.ratelimit;

import io.github.bucket4j.BucketConfiguration;
import io.github.bucket4j.ConsumptionProbe;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import secops.threatgraph.core.domain.model.OperationClass;
import secops.threatgraph.core.port.out.ConsumeResult;
import secops.threatgraph.core.port.out.RateLimiter;
import secops.threatgraph.global.executor.LogicExecutor;
import secops.threatgraph.global.executor.TaskContext;

/**
 * Bucket4j 기반 (작업 분류, 주체) 토큰 버킷
 *
 * <p>버킷 키는 {@code {keyPrefix}:{operation}:{principal}}입니다. 저장소 장애 시 정책에 따라 fail-open(허용) 또는
 * fail-close(60초 후 재시도 권장)로 응답합니다.
 */
@Slf4j
public class Bucket4jRateLimiter implements RateLimiter {

  static final long FAIL_CLOSE_RETRY_SECONDS = 60;

  private final BucketResolver bucketResolver;
  private final RateLimitPolicy policy;
  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;

  public Bucket4jRateLimiter(
      BucketResolver bucketResolver,
      RateLimitPolicy policy,
      LogicExecutor executor,
      MeterRegistry meterRegistry) {
    this.bucketResolver = bucketResolver;
    this.policy = policy;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public ConsumeResult tryConsume(OperationClass operationClass, String principalKey, long tokens) {
    BucketLimit limit = policy.limitFor(operationClass).orElse(null);
    if (limit == null) {
      return ConsumeResult.allowed(Long.MAX_VALUE);
    }
    TaskContext context =
        TaskContext.of("RateLimit", "Consume", operationClass.configKey() + ":" + maskKey(principalKey));

    return executor.executeOrCatch(
        () -> doTryConsume(operationClass, principalKey, tokens, limit),
        e -> handleFailure(operationClass, principalKey),
        context);
  }

  private ConsumeResult doTryConsume(
      OperationClass operationClass, String principalKey, long tokens, BucketLimit limit) {
    ConsumptionProbe probe =
        bucketResolver
            .resolve(buildFullKey(operationClass, principalKey), () -> buildConfiguration(limit))
            .tryConsumeAndReturnRemaining(tokens);

    recordMetrics(operationClass, probe.isConsumed());

    if (probe.isConsumed()) {
      return ConsumeResult.allowed(probe.getRemainingTokens());
    }
    return ConsumeResult.denied(probe.getRemainingTokens(), retryAfterSeconds(probe, limit));
  }

  /** 용량보다 큰 요청은 영원히 채워지지 않으므로 리필 주기로 제한합니다. */
  private static long retryAfterSeconds(ConsumptionProbe probe, BucketLimit limit) {
    long periodSeconds = Math.max(limit.refillPeriod().toSeconds(), 1);
    if (probe.getNanosToWaitForRefill() == Long.MAX_VALUE) {
      return periodSeconds;
    }
    long seconds = TimeUnit.NANOSECONDS.toSeconds(probe.getNanosToWaitForRefill());
    return Math.min(Math.max(seconds, 1), periodSeconds);
  }

  private static BucketConfiguration buildConfiguration(BucketLimit limit) {
    return BucketConfiguration.builder().addLimit(limit.toBandwidth()).build();
  }

  String buildFullKey(OperationClass operationClass, String principalKey) {
    return policy.keyPrefix() + ":" + operationClass.configKey() + ":" + principalKey;
  }

  private ConsumeResult handleFailure(OperationClass operationClass, String principalKey) {
    if (policy.failOpen()) {
      log.warn(
          "[RateLimit-FailOpen] Store failure, allowing request: operation={}, key={}",
          operationClass,
          maskKey(principalKey));
      meterRegistry.counter("ratelimit.failopen", "operation", operationClass.configKey()).increment();
      return ConsumeResult.failOpen();
    }

    log.warn(
        "[RateLimit-FailClose] Store failure, denying request: operation={}, key={}",
        operationClass,
        maskKey(principalKey));
    meterRegistry.counter("ratelimit.failclose", "operation", operationClass.configKey()).increment();
    return ConsumeResult.denied(0, FAIL_CLOSE_RETRY_SECONDS);
  }

  private void recordMetrics(OperationClass operationClass, boolean consumed) {
    meterRegistry
        .counter(
            "ratelimit.consume",
            "operation",
            operationClass.configKey(),
            "result",
            consumed ? "allowed" : "denied")
        .increment();
  }

  /** 마지막 4자만 남기고 가립니다. */
  static String maskKey(String key) {
    if (key == null || key.length() <= 4) {
      return "****";
    }
    return "****" + key.substring(key.length() - 4);
  }
}

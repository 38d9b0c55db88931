package secops.threatgraph.global.executor;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import secops.threatgraph.common.function.ThrowingSupplier;
import secops.threatgraph.error.exception.base.BaseException;
import secops.threatgraph.global.executor.function.ThrowingRunnable;
import secops.threatgraph.global.executor.strategy.ExceptionTranslator;
import secops.threatgraph.global.util.ExceptionUtils;

/**
 * LogicExecutor 기본 구현체
 *
 * <ul>
 *   <li>Checked Exception → Runtime Exception 자동 변환
 *   <li>Micrometer 타이머 {@code logic.executor{component,operation,result}}
 *   <li><b>Error 격리</b>: OOM 등은 캐치하지 않고 상위로 폭발
 *   <li>dynamicValue는 로그에만 기록, 메트릭 태그에는 고정 Taxonomy만 사용
 * </ul>
 *
 * <p>Spring 빈 등록은 module-app 설정에서 수행합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String TIMER_NAME = "logic.executor";

  private final MeterRegistry meterRegistry;

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithMetrics(task, context, ExceptionTranslator.defaultTranslator());
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(task, e -> defaultValue, context);
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      T result = task.get();
      record(sample, context, "success");
      return result;
    } catch (Throwable t) {
      if (t instanceof Error error) {
        throw error;
      }
      record(sample, context, "recovered");
      Throwable cause = ExceptionUtils.unwrapAsyncException(t);
      log.debug("[{}] 예외 발생, 복구 로직 실행: {}", context.toTaskName(), cause.toString());
      return recovery.apply(cause);
    }
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  @Override
  public <T> T executeWithFinally(
      ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context) {
    try {
      return execute(task, context);
    } finally {
      finallyBlock.run();
    }
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context) {
    return executeWithMetrics(task, context, translator);
  }

  private <T> T executeWithMetrics(
      ThrowingSupplier<T> task, TaskContext context, ExceptionTranslator translator) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      T result = task.get();
      record(sample, context, "success");
      return result;
    } catch (Throwable t) {
      if (t instanceof Error error) {
        throw error;
      }
      record(sample, context, "failure");
      RuntimeException translated = translator.translate(t, context);
      logFailure(context, translated);
      throw translated;
    }
  }

  private void logFailure(TaskContext context, RuntimeException e) {
    if (e instanceof BaseException be && be.getErrorCode().getStatus().is4xxClientError()) {
      log.info("[{}] 요청 거부: {}", context.toTaskName(), e.getMessage());
      return;
    }
    log.error("[{}] 작업 실패: {}", context.toTaskName(), e.getMessage(), e);
  }

  private void record(Timer.Sample sample, TaskContext context, String result) {
    sample.stop(
        Timer.builder(TIMER_NAME)
            .tag("component", context.component())
            .tag("operation", context.operation())
            .tag("result", result)
            .register(meterRegistry));
  }
}

package secops.threatgraph.core.loader;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.Executor;
import secops.threatgraph.global.executor.LogicExecutor;

/**
 * 로더들이 공유하는 실행 자원
 *
 * @param fetchExecutor 배치 함수를 실행할 Executor. {@code Runnable::run}이면 dispatch 스레드에서 동기 실행
 */
public record LoaderSupport(
    LogicExecutor logicExecutor, MeterRegistry meterRegistry, Executor fetchExecutor) {

  public static LoaderSupport direct(LogicExecutor logicExecutor, MeterRegistry meterRegistry) {
    return new LoaderSupport(logicExecutor, meterRegistry, Runnable::run);
  }
}

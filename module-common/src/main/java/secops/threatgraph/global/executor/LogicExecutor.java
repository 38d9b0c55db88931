package secops.threatgraph.global.executor;

import java.util.function.Function;
import secops.threatgraph.common.function.ThrowingSupplier;
import secops.threatgraph.global.executor.function.ThrowingRunnable;
import secops.threatgraph.global.executor.strategy.ExceptionTranslator;

/**
 * try-catch 없이 예외 정책과 메트릭을 일관되게 적용하는 실행 템플릿
 *
 * <ul>
 *   <li>{@link Error}는 잡지 않습니다.
 *   <li>{@code BaseException}은 그대로 전파하고, 그 외 예외는 {@code InternalSystemException}으로 규격화합니다.
 * </ul>
 */
public interface LogicExecutor {

  /** 작업을 실행하고 결과를 반환합니다. 실패 시 규격화된 예외를 던집니다. */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /** 실패 시 기본값을 반환합니다. 조회성 작업에서 사용합니다. */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  /**
   * 실패 시 복구 함수를 호출합니다.
   *
   * @param recovery 원인 예외(async 래퍼 제거됨)를 받아 대체 결과를 만드는 함수
   */
  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  void executeVoid(ThrowingRunnable task, TaskContext context);

  <T> T executeWithFinally(ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context);

  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}

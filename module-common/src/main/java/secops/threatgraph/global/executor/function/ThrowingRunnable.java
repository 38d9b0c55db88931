package secops.threatgraph.global.executor.function;

/**
 * 예외를 던질 수 있는 void 작업
 *
 * <p>표준 {@link Runnable}과 달리 Checked Exception을 던질 수 있습니다.
 *
 * @see secops.threatgraph.common.function.ThrowingSupplier
 */
@FunctionalInterface
public interface ThrowingRunnable {

  void run() throws Throwable;
}

package secops.threatgraph.global.executor.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import secops.threatgraph.error.exception.EventCodecException;
import secops.threatgraph.error.exception.InternalSystemException;
import secops.threatgraph.error.exception.base.BaseException;
import secops.threatgraph.global.executor.TaskContext;
import secops.threatgraph.global.util.ExceptionUtils;

/** 기술 예외를 도메인 예외로 변환하는 전략 */
@FunctionalInterface
public interface ExceptionTranslator {

  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Error guard + async unwrap을 선행 적용하는 Decorator
   *
   * <ol>
   *   <li>Error → 즉시 rethrow
   *   <li>CompletionException/ExecutionException → 원본으로 unwrap
   *   <li>BaseException → 그대로 반환
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = ExceptionUtils.unwrapAsyncException(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new InternalSystemException(context.toTaskName(), unwrapped));
  }

  /** 이벤트/캐시 값 JSON 직렬화 실패 변환기 */
  static ExceptionTranslator forJson() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof JsonProcessingException) {
            return new EventCodecException(context.toTaskName(), unwrapped);
          }
          return new InternalSystemException("json:" + context.operation(), unwrapped);
        });
  }

  /** 시작 시 구독/리스너 등록 실패 변환기 */
  static ExceptionTranslator forStartup(String componentName) {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) ->
            new InternalSystemException(
                "startup:" + componentName + ":" + context.operation(), unwrapped));
  }
}

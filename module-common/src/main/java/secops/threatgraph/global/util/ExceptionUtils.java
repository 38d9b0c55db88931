package secops.threatgraph.global.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** CompletionException / ExecutionException 래퍼를 벗겨 원인 예외를 찾습니다. */
public final class ExceptionUtils {

  public static Throwable unwrapAsyncException(Throwable throwable) {
    Throwable cause = throwable;
    while (cause instanceof CompletionException || cause instanceof ExecutionException) {
      cause = cause.getCause();
      if (cause == null) {
        return throwable;
      }
    }
    return cause;
  }

  private ExceptionUtils() {}
}

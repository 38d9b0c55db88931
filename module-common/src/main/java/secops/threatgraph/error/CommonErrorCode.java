package secops.threatgraph.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST),
  QUERY_TOO_COMPLEX(
      "C002", "쿼리 복잡도가 허용치를 초과했습니다 (점수: %s, 상한: %s)", HttpStatus.BAD_REQUEST),
  QUERY_DEPTH_EXCEEDED(
      "C003", "쿼리 중첩 깊이가 허용치를 초과했습니다 (깊이: %s, 최대: %s)", HttpStatus.BAD_REQUEST),
  SUBSCRIPTION_FORBIDDEN("C004", "구독 권한이 없습니다 (토픽: %s)", HttpStatus.FORBIDDEN),
  RATE_LIMIT_EXCEEDED(
      "R001", "요청 한도를 초과했습니다. %s초 후 다시 시도해주세요.", HttpStatus.TOO_MANY_REQUESTS),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다 (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  BATCH_FETCH_FAILURE(
      "S002", "배치 조회 실패 (로더: %s, 키: %s)", HttpStatus.INTERNAL_SERVER_ERROR),
  EVENT_CODEC_ERROR("S003", "이벤트 직렬화 처리 실패 (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  CACHE_UNAVAILABLE("S004", "공유 캐시 저장소에 접근할 수 없습니다 (%s)", HttpStatus.SERVICE_UNAVAILABLE);

  private final String code;
  private final String message;
  private final HttpStatus status;
}

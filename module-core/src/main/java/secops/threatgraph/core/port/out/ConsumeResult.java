package secops.threatgraph.core.port.out;

/**
 * Rate Limit 토큰 소비 결과
 *
 * @param allowed 요청 허용 여부
 * @param remainingTokens 남은 토큰 수
 * @param retryAfterSeconds 재시도까지 대기 시간 (초), 허용 시 0
 */
public record ConsumeResult(boolean allowed, long remainingTokens, long retryAfterSeconds) {

  public static ConsumeResult allowed(long remainingTokens) {
    return new ConsumeResult(true, remainingTokens, 0);
  }

  public static ConsumeResult denied(long remainingTokens, long retryAfterSeconds) {
    return new ConsumeResult(false, remainingTokens, retryAfterSeconds);
  }

  /** 저장소 장애 시 허용 결과 (remainingTokens = -1) */
  public static ConsumeResult failOpen() {
    return new ConsumeResult(true, -1, 0);
  }

  public boolean isFailOpen() {
    return allowed && remainingTokens == -1;
  }
}

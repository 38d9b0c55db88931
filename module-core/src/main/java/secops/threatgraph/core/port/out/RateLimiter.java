package secops.threatgraph.core.port.out;

import secops.threatgraph.core.domain.model.OperationClass;

/**
 * (작업 분류, 주체) 단위 토큰 버킷 포트
 *
 * <p>구현체는 여러 인스턴스 사이에서 원자적으로 차감해야 합니다. 저장소 장애 시 fail-open/fail-close 정책은 구현체가 결정합니다.
 */
public interface RateLimiter {

  ConsumeResult tryConsume(OperationClass operationClass, String principalKey, long tokens);
}

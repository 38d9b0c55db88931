package secops.threatgraph.core.admission;

/**
 * 실행 전 승인 게이트
 *
 * <p>거부 시 {@link secops.threatgraph.error.exception.base.ClientBaseException} 하위 예외를 던집니다.
 */
public interface AdmissionGate {

  /** 메트릭 태그용 거부 사유 이름 */
  String name();

  void check(AdmissionContext context);
}

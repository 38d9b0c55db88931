package secops.threatgraph.core.port.out;

import secops.threatgraph.core.domain.model.ChangeEvent;

/** 변경 이벤트 발행 포트. 단일 인스턴스 구현과 클러스터 fan-out 구현이 있습니다. */
public interface ChangeEventPublisher {

  void publish(ChangeEvent event);
}

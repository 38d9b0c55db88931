package secops.threatgraph.core.event;

import lombok.RequiredArgsConstructor;
import secops.threatgraph.core.domain.model.ChangeEvent;
import secops.threatgraph.core.port.out.ChangeEventPublisher;

/** 같은 프로세스의 라우터로 바로 전달하는 발행자 (단일 인스턴스 구성) */
@RequiredArgsConstructor
public class LocalChangeEventPublisher implements ChangeEventPublisher {

  private final SubscriptionRouter router;

  @Override
  public void publish(ChangeEvent event) {
    router.publish(event.topic(), event);
  }
}

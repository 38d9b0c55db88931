package secops.threatgraph.core.port.out;

/** L1 무효화 브로드캐스트 포트. 단일 인스턴스 구성에서는 {@link #NOOP}을 사용합니다. */
@FunctionalInterface
public interface CacheInvalidationPublisher {

  CacheInvalidationPublisher NOOP = event -> {};

  void publish(CacheInvalidationEvent event);
}

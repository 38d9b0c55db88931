package secops.threatgraph.core.event;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;
import secops.threatgraph.core.domain.model.ChangeEvent;
import secops.threatgraph.core.domain.model.Severity;

/**
 * 구독 큐 불변식 (Property-Based)
 *
 * <ul>
 *   <li>CRITICAL 이벤트는 절대 버려지지 않는다
 *   <li>남은 이벤트는 발행 순서를 유지한다
 *   <li>받은 수 = 큐 크기 + 버린 수
 * </ul>
 */
class SubscriptionQueuePropertyTest {

  @Property(tries = 200)
  void criticalEventsSurviveAnyBurst(
      @ForAll("severities") List<Severity> burst, @ForAll @IntRange(min = 1, max = 8) int capacity) {
    Subscription sub =
        new Subscription(
            EventFixtures.TOPIC,
            SubscriptionFilters.always(),
            EventFixtures.analyst("p"),
            capacity,
            Runnable::run);
    List<String> criticalIds = new ArrayList<>();
    for (int i = 0; i < burst.size(); i++) {
      Severity severity = burst.get(i);
      String id = "e" + i;
      if (severity == Severity.CRITICAL) {
        criticalIds.add(id);
      }
      sub.offer(EventFixtures.event(id, severity));
    }

    int size = sub.size();
    List<ChangeEvent> remaining = sub.drain(Integer.MAX_VALUE);
    List<String> remainingIds = remaining.stream().map(ChangeEvent::entityId).toList();

    assertThat(remainingIds).containsAll(criticalIds);
    assertThat(remaining)
        .extracting(e -> Integer.parseInt(e.entityId().substring(1)))
        .isSorted();
    assertThat(size + sub.droppedCount()).isEqualTo(burst.size());
  }

  @Provide
  Arbitrary<List<Severity>> severities() {
    return Arbitraries.of(Severity.class).list().ofMaxSize(64);
  }
}

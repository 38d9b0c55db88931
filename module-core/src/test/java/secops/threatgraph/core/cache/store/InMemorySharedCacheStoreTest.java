package secops.threatgraph.core.cache.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import secops.threatgraph.core.port.out.SharedCacheStore;
import secops.threatgraph.core.support.MutableClock;

@Tag("unit")
@DisplayName("InMemorySharedCacheStore 테스트")
class InMemorySharedCacheStoreTest {

  private MutableClock clock;
  private InMemorySharedCacheStore store;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingNow();
    store = new InMemorySharedCacheStore(clock);
  }

  @Nested
  @DisplayName("남은 수명")
  class RemainingTtl {

    @Test
    @DisplayName("경과 시간만큼 줄어든 수명을 돌려준다")
    void shrinksWithTime() {
      store.set("threat:T1", "v", Duration.ofSeconds(1));
      clock.advance(Duration.ofMillis(400));

      assertThat(store.remainingTtl("threat:T1")).contains(Duration.ofMillis(600));
    }

    @Test
    @DisplayName("만료 없는 키는 NO_EXPIRY, 없는 키는 empty")
    void noExpiryAndMissing() {
      store.set("threat:T2", "v", Duration.ZERO);

      assertThat(store.remainingTtl("threat:T2")).contains(SharedCacheStore.NO_EXPIRY);
      assertThat(store.remainingTtl("threat:none")).isEmpty();
    }
  }

  @Nested
  @DisplayName("만료 항목 정리")
  class Purge {

    @Test
    @DisplayName("읽히지 않은 만료 값/카운터/집합도 keys 스캔에서 제거된다")
    void keysScanRemovesUnreadExpiredEntries() {
      store.set("threat:T1", "v", Duration.ofSeconds(1));
      store.incr("counter:x", 1, Duration.ofSeconds(1));
      store.addToSet("tag:campaign:C1", List.of("threat:T1"), Duration.ofSeconds(1));
      store.set("threat:T2", "v", Duration.ofMinutes(5));

      clock.advance(Duration.ofSeconds(2));

      assertThat(store.keys("*")).containsExactly("threat:T2");
      assertThat(store.storedEntries()).isEqualTo(1);
    }

    @Test
    @DisplayName("쓰기가 누적되면 주기적으로 정리한다")
    void sweepsAfterWriteInterval() {
      for (int i = 0; i < 100; i++) {
        store.set("ioc:" + i, "v", Duration.ofSeconds(1));
      }
      clock.advance(Duration.ofSeconds(2));

      for (int i = 0; i < InMemorySharedCacheStore.SWEEP_INTERVAL; i++) {
        store.set("feed:live", "v", Duration.ofMinutes(5));
      }

      assertThat(store.storedEntries()).isEqualTo(1);
    }

    @Test
    @DisplayName("purgeExpired는 제거한 항목 수를 돌려준다")
    void purgeReportsRemoved() {
      store.set("threat:T1", "v", Duration.ofSeconds(1));
      store.incr("counter:x", 1, Duration.ofSeconds(1));
      clock.advance(Duration.ofSeconds(1));

      assertThat(store.purgeExpired()).isEqualTo(2);
    }
  }
}

package secops.threatgraph.core.loader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import secops.threatgraph.core.support.CoreFixtures;

@Tag("unit")
@DisplayName("LoaderRegistry 테스트")
class LoaderRegistryTest {

  private LoaderRegistry registry;

  @BeforeEach
  void setUp() {
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    registry = new LoaderRegistry(LoaderSupport.direct(CoreFixtures.logicExecutor(meterRegistry), meterRegistry));
  }

  @Test
  @DisplayName("먼저 등록된 로더에 이어진 load는 다음 라운드에서 처리된다")
  void chainedLoadsAreFlushedInLaterRounds() {
    Map<String, String> parentOf = Map.of("ioc-1", "threat-1", "ioc-2", "threat-1");
    List<List<String>> threatCalls = new ArrayList<>();
    BatchLoader<String, String> threats =
        registry.register(
            "threat",
            keys -> {
              threatCalls.add(List.copyOf(keys));
              return keys.stream().map(k -> k.toUpperCase()).toList();
            },
            LoaderOptions.forKind(LoaderKind.ENTITY, () -> null));
    BatchLoader<String, String> iocs =
        registry.register(
            "ioc",
            keys -> keys.stream().map(parentOf::get).toList(),
            LoaderOptions.forKind(LoaderKind.ENTITY, () -> null));

    CompletableFuture<String> first = iocs.load("ioc-1").thenCompose(threats::load);
    CompletableFuture<String> second = iocs.load("ioc-2").thenCompose(threats::load);
    int rounds = registry.dispatchAll();

    assertThat(rounds).isEqualTo(2);
    assertThat(threatCalls).containsExactly(List.of("threat-1"));
    assertThat(first.join()).isEqualTo("THREAT-1");
    assertThat(second.join()).isEqualTo("THREAT-1");
    assertThat(registry.getDispatchCount()).isEqualTo(2);
    assertThat(registry.getFetchedKeyCount()).isEqualTo(3);
  }

  @Test
  @DisplayName("대기 키가 없으면 라운드 0")
  void noPending() {
    registry.register("noop", keys -> keys, LoaderOptions.forKind(LoaderKind.ENTITY, () -> null));

    assertThat(registry.dispatchAll()).isZero();
  }

  @Test
  @DisplayName("같은 이름 중복 등록은 거부한다")
  void duplicateName() {
    registry.register("dup", keys -> keys, LoaderOptions.forKind(LoaderKind.ENTITY, () -> null));

    assertThatThrownBy(
            () -> registry.register("dup", keys -> keys, LoaderOptions.forKind(LoaderKind.ENTITY, () -> null)))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("fetch 풀이 포화돼도 dispatchAll은 던지지 않고 모든 키를 fallback으로 해소한다")
  void dispatchAllSurvivesRejectingPool() {
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    LoaderRegistry saturated =
        new LoaderRegistry(
            new LoaderSupport(
                CoreFixtures.logicExecutor(meterRegistry),
                meterRegistry,
                task -> {
                  throw new RejectedExecutionException("fetch pool shut down");
                }));
    BatchLoader<String, String> threats =
        saturated.register(
            "threat",
            keys -> keys.stream().map(String::toUpperCase).toList(),
            LoaderOptions.forKind(LoaderKind.ENTITY, () -> "unavailable"));

    CompletableFuture<String> t1 = threats.load("t1");

    assertThatCode(saturated::dispatchAll).doesNotThrowAnyException();
    assertThat(t1).isCompletedWithValue("unavailable");
    assertThat(saturated.hasPending()).isFalse();
  }
}

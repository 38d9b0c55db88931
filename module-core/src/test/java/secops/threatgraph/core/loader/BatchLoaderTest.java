package secops.threatgraph.core.loader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import secops.threatgraph.core.support.CoreFixtures;

@Tag("unit")
@DisplayName("BatchLoader 테스트")
class BatchLoaderTest {

  private SimpleMeterRegistry meterRegistry;
  private LoaderSupport support;
  private List<List<String>> calls;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    support = LoaderSupport.direct(CoreFixtures.logicExecutor(meterRegistry), meterRegistry);
    calls = new ArrayList<>();
  }

  private BatchLoader<String, String> countingLoader(int maxBatchSize) {
    BatchFunction<String, String> fn =
        keys -> {
          calls.add(List.copyOf(keys));
          return keys.stream().map(k -> "result" + k).toList();
        };
    return new BatchLoader<>("test", fn, LoaderOptions.of(maxBatchSize, null, () -> null), support);
  }

  @Nested
  @DisplayName("배치 및 중복 제거")
  class Batching {

    @Test
    @DisplayName("한 틱에 요청한 [A,B,C]는 fetch 한 번으로 순서대로 해소된다")
    void singleCallInKeyOrder() {
      BatchLoader<String, String> loader = countingLoader(100);

      CompletableFuture<String> a = loader.load("A");
      CompletableFuture<String> b = loader.load("B");
      CompletableFuture<String> c = loader.load("C");
      loader.dispatch().join();

      assertThat(calls).containsExactly(List.of("A", "B", "C"));
      assertThat(List.of(a.join(), b.join(), c.join()))
          .containsExactly("resultA", "resultB", "resultC");
    }

    @Test
    @DisplayName("같은 키를 여러 번 요청해도 한 번만 fetch 한다")
    void deduplicates() {
      BatchLoader<String, String> loader = countingLoader(100);

      CompletableFuture<String> first = loader.load("A");
      CompletableFuture<String> second = loader.load("A");
      loader.load("B");
      loader.dispatch().join();

      assertThat(calls).containsExactly(List.of("A", "B"));
      assertThat(first).isSameAs(second);
      assertThat(first.join()).isEqualTo("resultA");
    }

    @Test
    @DisplayName("maxBatchSize를 넘으면 나누어 보낸다")
    void splitsByMaxBatchSize() {
      BatchLoader<String, String> loader = countingLoader(2);

      CompletableFuture<List<String>> all = loader.loadMany(List.of("A", "B", "C", "D", "E"));
      loader.dispatch().join();

      assertThat(calls).containsExactly(List.of("A", "B"), List.of("C", "D"), List.of("E"));
      assertThat(all.join()).containsExactly("resultA", "resultB", "resultC", "resultD", "resultE");
    }

    @Test
    @DisplayName("dispatch 전에는 fetch 하지 않는다")
    void noFetchBeforeDispatch() {
      BatchLoader<String, String> loader = countingLoader(100);

      CompletableFuture<String> future = loader.load("A");

      assertThat(calls).isEmpty();
      assertThat(future).isNotDone();
      assertThat(loader.pendingCount()).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("요청 범위 캐시")
  class Caching {

    @Test
    @DisplayName("해소된 키는 다시 fetch 하지 않는다")
    void cachedAfterResolve() {
      BatchLoader<String, String> loader = countingLoader(100);
      loader.load("A");
      loader.dispatch().join();

      CompletableFuture<String> again = loader.load("A");
      loader.dispatch().join();

      assertThat(calls).hasSize(1);
      assertThat(again.join()).isEqualTo("resultA");
    }

    @Test
    @DisplayName("clear 후 load는 새로 fetch 한다")
    void clearThenLoadRefetches() {
      BatchLoader<String, String> loader = countingLoader(100);
      loader.load("A");
      loader.dispatch().join();

      loader.clear("A");
      loader.load("A");
      loader.dispatch().join();

      assertThat(calls).containsExactly(List.of("A"), List.of("A"));
    }

    @Test
    @DisplayName("prime 후 load는 fetch 없이 값을 돌려준다")
    void primeThenLoadSkipsFetch() {
      BatchLoader<String, String> loader = countingLoader(100);

      loader.prime("A", "primed");
      CompletableFuture<String> result = loader.load("A");
      loader.dispatch().join();

      assertThat(result.join()).isEqualTo("primed");
      assertThat(calls).isEmpty();
    }

    @Test
    @DisplayName("prime은 이미 있는 값을 덮어쓰지 않는다")
    void primeDoesNotOverwrite() {
      BatchLoader<String, String> loader = countingLoader(100);
      loader.load("A");
      loader.dispatch().join();

      loader.prime("A", "other");

      assertThat(loader.load("A").join()).isEqualTo("resultA");
    }

    @Test
    @DisplayName("clearAll 후에는 모든 키를 다시 fetch 한다")
    void clearAll() {
      BatchLoader<String, String> loader = countingLoader(100);
      loader.loadMany(List.of("A", "B"));
      loader.dispatch().join();

      loader.clearAll();
      loader.loadMany(List.of("A", "B"));
      loader.dispatch().join();

      assertThat(calls).hasSize(2);
    }
  }

  @Nested
  @DisplayName("실패 격리")
  class FailureIsolation {

    @Test
    @DisplayName("배치 함수 예외 시 해당 배치 키는 fallback, 다른 배치는 정상 해소된다")
    void failingBatchDoesNotAffectOtherBatch() {
      BatchFunction<String, String> fn =
          keys -> {
            if (keys.contains("BAD")) {
              throw new IllegalStateException("store down");
            }
            return keys.stream().map(k -> "ok" + k).toList();
          };
      BatchLoader<String, String> loader =
          new BatchLoader<>("flaky", fn, LoaderOptions.of(1, null, () -> "fallback"), support);

      CompletableFuture<String> bad = loader.load("BAD");
      CompletableFuture<String> good = loader.load("GOOD");
      loader.dispatch().join();

      assertThat(bad.join()).isEqualTo("fallback");
      assertThat(good.join()).isEqualTo("okGOOD");
      assertThat(meterRegistry.get("loader.batch.failure").tag("loader", "flaky").counter().count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("fetch 풀이 작업을 거부하면 배치 키는 fallback으로 해소되고 dispatch는 예외 없이 끝난다")
    void rejectedSubmissionResolvesWithFallback() {
      LoaderSupport saturated =
          new LoaderSupport(
              CoreFixtures.logicExecutor(meterRegistry),
              meterRegistry,
              task -> {
                throw new RejectedExecutionException("fetch pool saturated");
              });
      BatchLoader<String, String> loader =
          new BatchLoader<>(
              "saturated",
              keys -> keys.stream().map(k -> "ok" + k).toList(),
              LoaderOptions.of(10, null, () -> "fallback"),
              saturated);

      CompletableFuture<String> a = loader.load("A");
      CompletableFuture<String> b = loader.load("B");

      assertThatCode(() -> loader.dispatch().join()).doesNotThrowAnyException();
      assertThat(List.of(a.join(), b.join())).containsExactly("fallback", "fallback");
      assertThat(
              meterRegistry.get("loader.batch.failure").tag("loader", "saturated").counter().count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("결과 길이가 키 수와 다르면 fallback으로 해소한다")
    void sizeMismatch() {
      BatchFunction<String, String> fn = keys -> List.of("only-one");
      BatchLoader<String, String> loader =
          new BatchLoader<>("short", fn, LoaderOptions.of(10, null, () -> null), support);

      CompletableFuture<List<String>> result = loader.loadMany(List.of("A", "B"));
      loader.dispatch().join();

      assertThat(result.join()).containsExactly(null, null);
    }

    @Test
    @DisplayName("null 값은 fallback 값으로 해소한다")
    void nullMapsToFallback() {
      BatchFunction<String, List<String>> fn =
          keys -> {
            List<List<String>> values = new ArrayList<>();
            keys.forEach(k -> values.add(null));
            return values;
          };
      BatchLoader<String, List<String>> loader =
          new BatchLoader<>("rel", fn, LoaderOptions.of(10, null, List::of), support);

      CompletableFuture<List<String>> result = loader.load("P1");
      loader.dispatch().join();

      assertThat(result.join()).isEmpty();
    }
  }

  @Nested
  @DisplayName("타임아웃")
  class Timeout {

    private ExecutorService pool;

    @BeforeEach
    void setUp() {
      pool = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
      pool.shutdownNow();
    }

    @Test
    @DisplayName("fetch가 타임아웃을 넘기면 키를 fallback으로 해소한다")
    void timedOutFetchResolvesFallback() throws InterruptedException {
      CountDownLatch release = new CountDownLatch(1);
      BatchFunction<String, String> slow =
          keys -> {
            release.await(5, TimeUnit.SECONDS);
            return keys;
          };
      LoaderSupport async =
          new LoaderSupport(CoreFixtures.logicExecutor(meterRegistry), meterRegistry, pool);
      BatchLoader<String, String> loader =
          new BatchLoader<>(
              "slow", slow, LoaderOptions.of(10, Duration.ofMillis(50), () -> "timeout"), async);

      CompletableFuture<String> result = loader.load("A");
      loader.dispatch().join();
      release.countDown();

      assertThat(result.join()).isEqualTo("timeout");
    }
  }
}

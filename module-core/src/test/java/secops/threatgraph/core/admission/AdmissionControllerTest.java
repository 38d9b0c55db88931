package secops.threatgraph.core.admission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import secops.threatgraph.core.domain.model.AuthContext;
import secops.threatgraph.core.domain.model.OperationClass;
import secops.threatgraph.core.domain.model.Role;
import secops.threatgraph.core.port.out.ConsumeResult;
import secops.threatgraph.core.port.out.RateLimiter;
import secops.threatgraph.error.exception.QueryDepthExceededException;
import secops.threatgraph.error.exception.QueryTooComplexException;
import secops.threatgraph.error.exception.RateLimitExceededException;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
@DisplayName("AdmissionController 테스트")
class AdmissionControllerTest {

  private static final AuthContext ANALYST = new AuthContext("user-1", "org-1", Role.ANALYST);

  @Mock private RateLimiter rateLimiter;

  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
  }

  private AdmissionController controller(AdmissionPolicy policy) {
    QueryCostAnalyzer analyzer =
        new QueryCostAnalyzer(FieldWeightTable.threatIntelDefaults(), policy.defaultListSize());
    return new AdmissionController(
        List.of(new QueryCostGate(analyzer, policy), new RateLimitGate(rateLimiter, policy)),
        meterRegistry);
  }

  /** iocs(first: n) { edges { node { enrichment { score } } } } → 10 + 503n */
  private static OperationShape enrichmentQuery(int first) {
    return OperationShape.query(
        FieldSelection.of(
            "iocs",
            Map.of("first", first),
            FieldSelection.of(
                "edges",
                FieldSelection.of(
                    "node", FieldSelection.of("enrichment", FieldSelection.leaf("score"))))));
  }

  private static OperationShape deepQuery(int depth) {
    FieldSelection current = FieldSelection.leaf("id");
    for (int i = 1; i < depth; i++) {
      current = FieldSelection.of("threat", current);
    }
    return OperationShape.query(current);
  }

  @Nested
  @DisplayName("비용 게이트")
  class CostGate {

    @Test
    @DisplayName("상한을 넘으면 점수와 상한을 담아 거부하고 rate limiter를 호출하지 않는다")
    void tooComplexRejectedBeforeAnyIo() {
      AdmissionController controller = controller(AdmissionPolicy.defaults());
      AdmissionRequest request =
          new AdmissionRequest(ANALYST, OperationClass.STANDARD_QUERY, enrichmentQuery(10));

      assertThatThrownBy(() -> controller.admit(request))
          .isInstanceOfSatisfying(
              QueryTooComplexException.class,
              e -> {
                assertThat(e.getScore()).isEqualTo(5040);
                assertThat(e.getCeiling()).isEqualTo(2000);
              });
      verifyNoInteractions(rateLimiter);
      assertThat(
              meterRegistry.get("admission.rejected").tag("reason", "cost").counter().count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("깊이 제한을 넘으면 비용 계산 전에 거부한다")
    void depthExceeded() {
      AdmissionController controller = controller(AdmissionPolicy.defaults());
      AdmissionRequest request =
          new AdmissionRequest(ANALYST, OperationClass.STANDARD_QUERY, deepQuery(11));

      assertThatThrownBy(() -> controller.admit(request))
          .isInstanceOf(QueryDepthExceededException.class);
      verifyNoInteractions(rateLimiter);
    }

    @Test
    @DisplayName("역할 배수를 켜면 상한이 역할에 따라 달라진다")
    void roleScaling() {
      AdmissionPolicy policy = new AdmissionPolicy(2000, 10, 10, true, false);
      AdmissionController controller = controller(policy);
      when(rateLimiter.tryConsume(eq(OperationClass.STANDARD_QUERY), anyString(), eq(1L)))
          .thenReturn(ConsumeResult.allowed(99));

      // 10 + 503 × 4 = 2022: ANALYST 2000 초과, ADMIN 4000 이내
      AdmissionRequest asAnalyst =
          new AdmissionRequest(ANALYST, OperationClass.STANDARD_QUERY, enrichmentQuery(4));
      AdmissionRequest asAdmin =
          new AdmissionRequest(
              new AuthContext("user-2", "org-1", Role.ADMIN),
              OperationClass.STANDARD_QUERY,
              enrichmentQuery(4));

      assertThatThrownBy(() -> controller.admit(asAnalyst))
          .isInstanceOf(QueryTooComplexException.class);
      AdmissionDecision decision = controller.admit(asAdmin);

      assertThat(decision.effectiveCeiling()).isEqualTo(4000);
      assertThat(decision.estimate().score()).isEqualTo(2022);
      assertThat(policy.effectiveCeiling(Role.VIEWER)).isEqualTo(1000);
    }
  }

  @Nested
  @DisplayName("rate limit 게이트")
  class RateGate {

    @Test
    @DisplayName("허용 시 점수만큼 복잡도 예산을 차감하고 권장 타임아웃을 돌려준다")
    void admittedWithBudget() {
      AdmissionController controller = controller(AdmissionPolicy.defaults());
      when(rateLimiter.tryConsume(OperationClass.STANDARD_QUERY, "user-1", 1))
          .thenReturn(ConsumeResult.allowed(99));
      when(rateLimiter.tryConsume(OperationClass.QUERY_COMPLEXITY, "user-1", 513))
          .thenReturn(ConsumeResult.allowed(10_000));

      AdmissionDecision decision =
          controller.admit(
              new AdmissionRequest(ANALYST, OperationClass.STANDARD_QUERY, enrichmentQuery(1)));

      assertThat(decision.estimate().score()).isEqualTo(513);
      assertThat(decision.rateLimit().remainingTokens()).isEqualTo(99);
      assertThat(decision.suggestedTimeout()).isEqualTo(Duration.ofMillis(30_000 + 51_300));
    }

    @Test
    @DisplayName("토큰이 없으면 재시도 시간을 담아 거부한다")
    void rateLimited() {
      AdmissionController controller = controller(AdmissionPolicy.defaults());
      when(rateLimiter.tryConsume(OperationClass.ENRICHMENT, "user-1", 1))
          .thenReturn(ConsumeResult.denied(0, 42));

      assertThatThrownBy(
              () -> controller.admit(new AdmissionRequest(ANALYST, OperationClass.ENRICHMENT, null)))
          .isInstanceOfSatisfying(
              RateLimitExceededException.class,
              e -> {
                assertThat(e.getRetryAfterSeconds()).isEqualTo(42);
                assertThat(e.getOperationClass()).isEqualTo("ENRICHMENT");
              });
      verify(rateLimiter, never())
          .tryConsume(eq(OperationClass.QUERY_COMPLEXITY), anyString(), anyLong());
      assertThat(
              meterRegistry.get("admission.rejected").tag("reason", "rate").counter().count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("형태가 없는 요청은 비용 0으로 요청 토큰만 차감한다")
    void shapelessRequest() {
      AdmissionController controller = controller(AdmissionPolicy.defaults());
      when(rateLimiter.tryConsume(OperationClass.SUBSCRIPTION_OPEN, "user-1", 1))
          .thenReturn(ConsumeResult.failOpen());

      AdmissionDecision decision =
          controller.admit(new AdmissionRequest(ANALYST, OperationClass.SUBSCRIPTION_OPEN, null));

      assertThat(decision.estimate().score()).isZero();
      assertThat(decision.rateLimit().isFailOpen()).isTrue();
      assertThat(decision.suggestedTimeout()).isEqualTo(Duration.ofSeconds(30));
    }
  }
}

package secops.threatgraph.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import secops.threatgraph.core.admission.AdmissionController;
import secops.threatgraph.core.admission.AdmissionDecision;
import secops.threatgraph.core.admission.AdmissionRequest;
import secops.threatgraph.core.admission.OperationShape;
import secops.threatgraph.core.cache.EntityCacheManager;
import secops.threatgraph.core.loader.LoaderRegistry;
import secops.threatgraph.core.loader.LoaderSettings;
import secops.threatgraph.core.loader.LoaderSupport;
import secops.threatgraph.core.loader.ThreatGraphLoaders;
import secops.threatgraph.core.port.out.EnrichmentProvider;
import secops.threatgraph.core.port.out.EntityStore;
import secops.threatgraph.core.port.out.OperationShapeParser;
import secops.threatgraph.core.port.out.RelationshipStore;
import secops.threatgraph.global.executor.LogicExecutor;
import secops.threatgraph.global.executor.TaskContext;
import secops.threatgraph.global.executor.strategy.ExceptionTranslator;

/**
 * 요청 처리 파이프라인
 *
 * <ol>
 *   <li>요청 문서 → 선택 형태
 *   <li>승인 (비용 → rate limit). 거부되면 로더/캐시 작업은 시작하지 않습니다.
 *   <li>요청 범위 로더 세트 생성
 *   <li>resolver 작업 실행 후 대기 중인 키가 없을 때까지 dispatch
 *   <li>권장 타임아웃 안에 결과 완료
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphRequestPipeline {

  private final OperationShapeParser shapeParser;
  private final AdmissionController admissionController;
  private final LoaderSupport loaderSupport;
  private final LoaderSettings loaderSettings;
  private final EntityStore entityStore;
  private final RelationshipStore relationshipStore;
  private final EnrichmentProvider enrichmentProvider;
  private final EntityCacheManager cacheManager;
  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;

  /**
   * @param resolverWork 로더로 값을 요청하고 최종 결과 future를 돌려주는 작업
   * @throws secops.threatgraph.error.exception.base.ClientBaseException 승인 거부 또는 잘못된 문서
   */
  public <T> GraphResult<T> execute(
      GraphRequest request, Function<ThreatGraphLoaders, CompletableFuture<T>> resolverWork) {
    OperationShape shape =
        request.document() == null
            ? null
            : shapeParser.parse(request.document(), request.operationName(), request.variables());
    AdmissionDecision decision =
        admissionController.admit(
            new AdmissionRequest(request.auth(), request.operationClass(), shape));

    ThreatGraphLoaders loaders = newLoaders();
    CompletableFuture<T> result = resolverWork.apply(loaders);
    int rounds = loaders.dispatchAll();

    T data = await(result, decision.suggestedTimeout(), request);
    log.debug(
        "[GraphRequestPipeline] Completed: operation={}, score={}, rounds={}, fetchedKeys={}",
        request.operationClass(),
        decision.estimate().score(),
        rounds,
        loaders.registry().getFetchedKeyCount());
    return new GraphResult<>(data, decision, rounds);
  }

  /** 요청마다 새 레지스트리. 요청 간 공유는 EntityCacheManager를 통해서만 일어납니다. */
  public ThreatGraphLoaders newLoaders() {
    return new ThreatGraphLoaders(
        new LoaderRegistry(loaderSupport),
        entityStore,
        relationshipStore,
        enrichmentProvider,
        cacheManager,
        objectMapper,
        loaderSettings);
  }

  private <T> T await(CompletableFuture<T> result, Duration timeout, GraphRequest request) {
    return executor.executeWithTranslation(
        () -> result.get(timeout.toMillis(), TimeUnit.MILLISECONDS),
        ExceptionTranslator.defaultTranslator(),
        TaskContext.of("GraphRequestPipeline", "Await", request.operationClass().name()));
  }
}

package secops.threatgraph.core.loader;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import secops.threatgraph.core.cache.CacheKeys;
import secops.threatgraph.core.cache.EntityCacheManager;
import secops.threatgraph.core.domain.model.EntityKey;
import secops.threatgraph.core.domain.model.GraphEntity;
import secops.threatgraph.core.port.out.EnrichmentProvider;
import secops.threatgraph.core.port.out.EntityStore;
import secops.threatgraph.core.port.out.RelationshipStore;

/**
 * 위협 인텔리전스 그래프용 요청 범위 로더 세트
 *
 * <p>요청마다 새로 만들며, 엔티티/관계/보강 로더는 공유 캐시를 먼저 확인합니다. 카운트 로더는 캐시를 거치지 않습니다.
 */
public class ThreatGraphLoaders {

  public static final Set<String> ENTITY_TYPES = Set.of("threat", "ioc", "actor", "campaign", "feed");

  /** (부모 유형, 관계명) 목록 */
  public static final List<Relation> RELATIONS =
      List.of(
          new Relation("threat", "iocs"),
          new Relation("threat", "actors"),
          new Relation("threat", "campaigns"),
          new Relation("actor", "threats"),
          new Relation("actor", "iocs"),
          new Relation("actor", "campaigns"),
          new Relation("campaign", "threats"),
          new Relation("campaign", "iocs"),
          new Relation("campaign", "actors"),
          new Relation("feed", "iocs"));

  public static final List<Relation> COUNTS =
      List.of(new Relation("actor", "threats"), new Relation("feed", "iocs"));

  private static final String IOC_ENRICHMENT = "iocEnrichment";
  private static final String THREAT_ATTRIBUTION = "threatAttribution";

  private final LoaderRegistry registry;
  private final Map<String, BatchLoader<String, GraphEntity>> entityLoaders;
  private final Map<Relation, BatchLoader<String, List<GraphEntity>>> relationLoaders;
  private final Map<Relation, BatchLoader<String, Long>> countLoaders;
  private final BatchLoader<String, GraphEntity> iocEnrichment;
  private final BatchLoader<String, GraphEntity> threatAttribution;

  public ThreatGraphLoaders(
      LoaderRegistry registry,
      EntityStore entityStore,
      RelationshipStore relationshipStore,
      EnrichmentProvider enrichmentProvider,
      EntityCacheManager cacheManager,
      ObjectMapper objectMapper,
      LoaderSettings settings) {
    this.registry = registry;
    JavaType entityType = objectMapper.constructType(GraphEntity.class);
    JavaType listType =
        objectMapper.getTypeFactory().constructCollectionType(List.class, GraphEntity.class);

    this.entityLoaders =
        ENTITY_TYPES.stream()
            .collect(
                Collectors.toMap(
                    Function.identity(),
                    type ->
                        registry.register(
                            type,
                            new CachingBatchFunction<>(
                                type,
                                BatchFunctions.entities(entityStore, type),
                                cacheManager,
                                id -> EntityKey.of(type, id),
                                entityType),
                            settings.<GraphEntity>options(LoaderKind.ENTITY, () -> null))));

    this.relationLoaders =
        RELATIONS.stream()
            .collect(
                Collectors.toMap(
                    Function.identity(),
                    relation ->
                        registry.register(
                            relation.loaderName(),
                            new CachingBatchFunction<>(
                                relation.loaderName(),
                                BatchFunctions.relationships(
                                    relationshipStore, relation.parentType(), relation.name()),
                                cacheManager,
                                parentId ->
                                    CacheKeys.relationship(
                                        relation.parentType(), parentId, relation.name()),
                                listType),
                            settings.<List<GraphEntity>>options(
                                LoaderKind.RELATIONSHIP, List::of))));

    this.countLoaders =
        COUNTS.stream()
            .collect(
                Collectors.toMap(
                    Function.identity(),
                    relation ->
                        registry.register(
                            relation.loaderName() + "Count",
                            BatchFunctions.counts(
                                relationshipStore, relation.parentType(), relation.name()),
                            settings.options(LoaderKind.RELATIONSHIP, () -> 0L))));

    this.iocEnrichment =
        registry.register(
            IOC_ENRICHMENT,
            new CachingBatchFunction<>(
                IOC_ENRICHMENT,
                BatchFunctions.<String, GraphEntity>perKey(IOC_ENRICHMENT, enrichmentProvider::enrichIoc),
                cacheManager,
                CacheKeys::iocEnrichment,
                entityType),
            settings.<GraphEntity>options(LoaderKind.ENRICHMENT, () -> null));

    this.threatAttribution =
        registry.register(
            THREAT_ATTRIBUTION,
            new CachingBatchFunction<>(
                THREAT_ATTRIBUTION,
                BatchFunctions.<String, GraphEntity>perKey(THREAT_ATTRIBUTION, enrichmentProvider::analyzeAttribution),
                cacheManager,
                CacheKeys::attribution,
                entityType),
            settings.<GraphEntity>options(LoaderKind.ANALYSIS, () -> null));
  }

  public BatchLoader<String, GraphEntity> entity(String entityType) {
    BatchLoader<String, GraphEntity> loader = entityLoaders.get(entityType);
    if (loader == null) {
      throw new IllegalArgumentException("Unknown entity type: " + entityType);
    }
    return loader;
  }

  public BatchLoader<String, List<GraphEntity>> relationship(String parentType, String relation) {
    BatchLoader<String, List<GraphEntity>> loader =
        relationLoaders.get(new Relation(parentType, relation));
    if (loader == null) {
      throw new IllegalArgumentException("Unknown relationship: " + parentType + "." + relation);
    }
    return loader;
  }

  public BatchLoader<String, Long> count(String parentType, String relation) {
    BatchLoader<String, Long> loader = countLoaders.get(new Relation(parentType, relation));
    if (loader == null) {
      throw new IllegalArgumentException("Unknown count: " + parentType + "." + relation);
    }
    return loader;
  }

  public BatchLoader<String, GraphEntity> iocEnrichment() {
    return iocEnrichment;
  }

  public BatchLoader<String, GraphEntity> threatAttribution() {
    return threatAttribution;
  }

  public LoaderRegistry registry() {
    return registry;
  }

  /**
   * 변경된 엔티티와 그 엔티티를 부모로 하는 관계/카운트 로더의 요청 범위 값을 비웁니다.
   */
  public void evict(String entityType, String id) {
    if (entityLoaders.containsKey(entityType)) {
      entityLoaders.get(entityType).clear(id);
    }
    relationLoaders.forEach(
        (relation, loader) -> {
          if (relation.parentType().equals(entityType)) {
            loader.clear(id);
          }
        });
    countLoaders.forEach(
        (relation, loader) -> {
          if (relation.parentType().equals(entityType)) {
            loader.clear(id);
          }
        });
    if ("ioc".equals(entityType)) {
      iocEnrichment.clear(id);
    }
    if ("threat".equals(entityType)) {
      threatAttribution.clear(id);
    }
  }

  public int dispatchAll() {
    return registry.dispatchAll();
  }

  /** 관계 식별자. loaderName 예: threatIocs */
  public record Relation(String parentType, String name) {
    public String loaderName() {
      return parentType + Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
  }
}

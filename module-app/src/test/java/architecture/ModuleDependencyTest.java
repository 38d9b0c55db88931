package architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * 모듈 의존 방향
 *
 * <pre>
 * module-app      (Spring Boot 설정, 파이프라인)
 *     ↓
 * module-infra    (Redisson, Bucket4j, graphql-java 어댑터)
 *     ↓
 * module-core     (로더, 캐시, 라우터, 승인 제어, 포트)
 *     ↓
 * module-common   (LogicExecutor, 예외 계층)
 * </pre>
 */
@DisplayName("Module Dependency Enforcement")
class ModuleDependencyTest {

  private static final String APP_PACKAGES_CONFIG = "secops.threatgraph.config..";
  private static final String APP_PACKAGES_SERVICE = "secops.threatgraph.service..";

  private final JavaClasses classes =
      new ClassFileImporter()
          .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
          .importPackages("secops.threatgraph");

  @Nested
  @DisplayName("Dependency Direction: app → infra → core → common")
  class DependencyDirectionTests {

    @Test
    @DisplayName("module-common must not depend on core, infra or app")
    void commonShouldNotDependOnUpperModules() {
      noClasses()
          .that()
          .resideInAnyPackage(
              "secops.threatgraph.global..",
              "secops.threatgraph.error..",
              "secops.threatgraph.common..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "secops.threatgraph.core..",
              "secops.threatgraph.infrastructure..",
              APP_PACKAGES_CONFIG,
              APP_PACKAGES_SERVICE)
          .check(classes);
    }

    @Test
    @DisplayName("module-core must not depend on infra or app")
    void coreShouldNotDependOnInfraOrApp() {
      noClasses()
          .that()
          .resideInAPackage("secops.threatgraph.core..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "secops.threatgraph.infrastructure..", APP_PACKAGES_CONFIG, APP_PACKAGES_SERVICE)
          .check(classes);
    }

    @Test
    @DisplayName("module-infra must not depend on app")
    void infraShouldNotDependOnApp() {
      noClasses()
          .that()
          .resideInAPackage("secops.threatgraph.infrastructure..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(APP_PACKAGES_CONFIG, APP_PACKAGES_SERVICE)
          .check(classes);
    }
  }
}

package architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Spring 격리 규칙
 *
 * <p>module-core는 Spring 없이 단위 테스트할 수 있어야 하고, module-infra 어댑터는 평범한 클래스로 두고 빈 등록은 module-app 설정이
 * 담당합니다.
 */
@DisplayName("Spring Framework Isolation Tests")
class SpringIsolationTest {

  private final JavaClasses classes =
      new ClassFileImporter()
          .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
          .importPackages("secops.threatgraph");

  @Nested
  @DisplayName("Core Module: Framework-Agnostic Enforcement")
  class CoreModuleSpringFreeTests {

    @Test
    @DisplayName("Core should not depend on Spring Framework classes")
    void coreShouldNotDependOnSpringFramework() {
      noClasses()
          .that()
          .resideInAPackage("secops.threatgraph.core..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("org.springframework..")
          .because("module-core must be testable without a Spring context")
          .check(classes);
    }

    @Test
    @DisplayName("Core should not depend on Redisson or Bucket4j")
    void coreShouldNotDependOnStoreClients() {
      noClasses()
          .that()
          .resideInAPackage("secops.threatgraph.core..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("org.redisson..", "io.github.bucket4j..", "graphql..")
          .because("store clients and the GraphQL parser are reached through ports")
          .check(classes);
    }
  }

  @Nested
  @DisplayName("Common/Infra Modules: No Stereotype Annotations")
  class NoStereotypeTests {

    @Test
    @DisplayName("Common should not use Spring annotations")
    void commonShouldNotUseSpringAnnotations() {
      noClasses()
          .that()
          .resideInAnyPackage(
              "secops.threatgraph.global..",
              "secops.threatgraph.error..",
              "secops.threatgraph.common..")
          .should()
          .beMetaAnnotatedWith("org.springframework.stereotype.Component")
          .because("module-common is shared by every module and must not register beans")
          .check(classes);
    }

    @Test
    @DisplayName("Infra adapters are wired by module-app configuration")
    void infraShouldNotUseSpringAnnotations() {
      noClasses()
          .that()
          .resideInAPackage("secops.threatgraph.infrastructure..")
          .should()
          .beMetaAnnotatedWith("org.springframework.stereotype.Component")
          .orShould()
          .beMetaAnnotatedWith("org.springframework.context.annotation.Configuration")
          .check(classes);
    }
  }
}

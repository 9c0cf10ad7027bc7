package architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * 모듈 의존 방향 검증
 *
 * <pre>
 * module-app → module-infra → module-core → module-common
 * </pre>
 *
 * <p>module-core는 프레임워크 독립적이어야 합니다. Spring 컨텍스트 없이 테스트되고, 캐시/생성 백엔드 구현은 포트 뒤에 숨습니다.
 */
@DisplayName("Clean Architecture Tests")
class CleanArchitectureTest {

  private final JavaClasses classes =
      new ClassFileImporter()
          .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
          .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_JARS)
          .importPackages("nik.notes");

  @Nested
  @DisplayName("module-core: 프레임워크 독립")
  class CoreIsolation {

    @Test
    @DisplayName("core는 Spring에 의존하지 않는다")
    void coreShouldNotDependOnSpring() {
      noClasses()
          .that()
          .resideInAPackage("nik.notes.core..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("org.springframework..")
          .because("core domain logic must be testable without a Spring context")
          .check(classes);
    }

    @Test
    @DisplayName("core는 인프라 라이브러리(Redisson, Resilience4j, WebFlux)에 의존하지 않는다")
    void coreShouldNotDependOnInfrastructureLibraries() {
      noClasses()
          .that()
          .resideInAPackage("nik.notes.core..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "org.redisson..", "io.github.resilience4j..", "reactor..", "io.netty..")
          .because("adapters live in module-infra behind the ports in nik.notes.core.port")
          .check(classes);
    }

    @Test
    @DisplayName("core는 infra/app 패키지에 의존하지 않는다")
    void coreShouldNotDependOnOuterLayers() {
      noClasses()
          .that()
          .resideInAPackage("nik.notes.core..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "nik.notes.infrastructure..",
              "nik.notes.service..",
              "nik.notes.controller..",
              "nik.notes.config..")
          .check(classes);
    }
  }

  @Nested
  @DisplayName("module-infra / module-common 의존 방향")
  class Layering {

    @Test
    @DisplayName("infra는 app 계층에 의존하지 않는다")
    void infraShouldNotDependOnApp() {
      noClasses()
          .that()
          .resideInAPackage("nik.notes.infrastructure..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "nik.notes.service..",
              "nik.notes.controller..",
              "nik.notes.config..",
              "nik.notes.global..")
          .check(classes);
    }

    @Test
    @DisplayName("common은 core/infra에 의존하지 않는다")
    void commonShouldNotDependOnOtherModules() {
      noClasses()
          .that()
          .resideInAnyPackage("nik.notes.error..", "nik.notes.common..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("nik.notes.core..", "nik.notes.infrastructure..")
          .check(classes);
    }

    @Test
    @DisplayName("컨트롤러는 인프라 어댑터를 직접 호출하지 않는다")
    void controllersGoThroughServices() {
      noClasses()
          .that()
          .resideInAPackage("nik.notes.controller..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("nik.notes.infrastructure..")
          .check(classes);
    }
  }
}

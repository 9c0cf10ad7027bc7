package nik.notes.infrastructure.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import nik.notes.core.domain.model.CapabilityStatus;
import nik.notes.core.domain.model.RequestParameters;
import nik.notes.core.domain.model.SuggestionList;
import nik.notes.core.port.out.GenerationBackend;
import nik.notes.error.exception.DependencyUnavailableException;
import nik.notes.error.exception.GenerationFailureException;
import nik.notes.infrastructure.executor.DefaultLogicExecutor;
import nik.notes.infrastructure.resilience.CircuitBreakerConfigs;
import nik.notes.infrastructure.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("GenerationBackendAdapter")
class GenerationBackendAdapterTest {

  private static final RequestParameters PARAMS =
      RequestParameters.builder().destination("Tokyo").durationDays(3).build();

  private GenerationBackend delegate;
  private CircuitBreaker circuitBreaker;

  @BeforeEach
  void setUp() {
    delegate = mock(GenerationBackend.class);
    circuitBreaker =
        CircuitBreaker.of(
            "generation-test", CircuitBreakerConfigs.consecutiveFailures(2, Duration.ofMinutes(1)));
  }

  private GenerationBackendAdapter adapter(boolean configured) {
    return new GenerationBackendAdapter(
        delegate, circuitBreaker, new DefaultLogicExecutor(), Clock.systemUTC(), configured);
  }

  @Test
  @DisplayName("정상 호출은 위임 결과를 그대로 반환")
  void delegates() {
    SuggestionList generated = SuggestionList.generated(List.of("1 x Passport"));
    when(delegate.generate(any(), any())).thenReturn(generated);

    assertThat(adapter(true).generate(PARAMS, Duration.ofSeconds(1))).isEqualTo(generated);
  }

  @Test
  @DisplayName("API 키가 없으면 UNAVAILABLE")
  void unconfiguredIsUnavailable() {
    assertThat(adapter(false).capability().status()).isEqualTo(CapabilityStatus.UNAVAILABLE);
    assertThat(adapter(true).capability().status()).isEqualTo(CapabilityStatus.AVAILABLE);
  }

  @Test
  @DisplayName("연속 실패로 브레이커가 열리면 위임 없이 DependencyUnavailable")
  void openBreakerShortCircuits() {
    when(delegate.generate(any(), any())).thenThrow(new GenerationFailureException("empty"));
    GenerationBackendAdapter adapter = adapter(true);

    for (int i = 0; i < 2; i++) {
      assertThatThrownBy(() -> adapter.generate(PARAMS, Duration.ofSeconds(1)))
          .isInstanceOf(GenerationFailureException.class);
    }

    assertThat(adapter.capability().status()).isEqualTo(CapabilityStatus.UNAVAILABLE);
    assertThatThrownBy(() -> adapter.generate(PARAMS, Duration.ofSeconds(1)))
        .isInstanceOf(DependencyUnavailableException.class);
    verify(delegate, times(2)).generate(any(), any());
  }

  @Test
  @DisplayName("상태가 그대로면 capability의 since는 마지막 전이 시각을 유지한다")
  void capabilitySinceTracksLastTransition() {
    MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    GenerationBackendAdapter adapter =
        new GenerationBackendAdapter(
            delegate, circuitBreaker, new DefaultLogicExecutor(), clock, true);

    clock.advance(Duration.ofHours(1));
    assertThat(adapter.capability().since()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));

    circuitBreaker.transitionToOpenState();
    clock.advance(Duration.ofMinutes(5));

    assertThat(adapter.capability().status()).isEqualTo(CapabilityStatus.UNAVAILABLE);
    assertThat(adapter.capability().since()).isEqualTo(Instant.parse("2026-01-01T01:00:00Z"));
  }
}

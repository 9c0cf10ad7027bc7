package nik.notes.infrastructure.generation;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import nik.notes.core.domain.model.CapabilityState;
import nik.notes.core.domain.model.CapabilityStatus;
import nik.notes.core.domain.model.RequestParameters;
import nik.notes.core.domain.model.SuggestionList;
import nik.notes.core.port.out.GenerationBackend;
import nik.notes.infrastructure.executor.LogicExecutor;
import nik.notes.infrastructure.executor.TaskContext;
import nik.notes.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 생성 백엔드 서킷 브레이커 데코레이터
 *
 * <p>API 키가 설정되지 않았으면 항상 UNAVAILABLE로 보고되어 호출 자체가 일어나지 않습니다. 브레이커 상태는 CLOSED → AVAILABLE,
 * HALF_OPEN → DEGRADED, OPEN → UNAVAILABLE로 매핑됩니다.
 */
@Slf4j
public class GenerationBackendAdapter implements GenerationBackend {

  private final GenerationBackend delegate;
  private final CircuitBreaker circuitBreaker;
  private final LogicExecutor executor;
  private final Clock clock;
  private final boolean configured;
  private final AtomicReference<CapabilityState> capability;

  public GenerationBackendAdapter(
      GenerationBackend delegate,
      CircuitBreaker circuitBreaker,
      LogicExecutor executor,
      Clock clock,
      boolean configured) {
    this.delegate = delegate;
    this.circuitBreaker = circuitBreaker;
    this.executor = executor;
    this.clock = clock;
    this.configured = configured;
    this.capability = new AtomicReference<>(new CapabilityState(currentStatus(), clock.instant()));
    circuitBreaker.getEventPublisher().onStateTransition(event -> capability());
    if (!configured) {
      log.warn("[Generation] API key not configured, mock generator will serve all requests");
    }
  }

  @Override
  public SuggestionList generate(RequestParameters params, Duration timeout) {
    return executor.executeWithTranslation(
        () -> circuitBreaker.executeSupplier(() -> delegate.generate(params, timeout)),
        ExceptionTranslator.forRemoteCall("generation-backend"),
        TaskContext.of("Generation", "generate"));
  }

  /** 상태가 바뀐 경우에만 {@code since}를 갱신한다. */
  public CapabilityState capability() {
    CapabilityStatus status = currentStatus();
    return capability.updateAndGet(
        previous ->
            previous.status() == status ? previous : new CapabilityState(status, clock.instant()));
  }

  private CapabilityStatus currentStatus() {
    if (!configured) {
      return CapabilityStatus.UNAVAILABLE;
    }
    return switch (circuitBreaker.getState()) {
      case OPEN, FORCED_OPEN -> CapabilityStatus.UNAVAILABLE;
      case HALF_OPEN -> CapabilityStatus.DEGRADED;
      default -> CapabilityStatus.AVAILABLE;
    };
  }
}

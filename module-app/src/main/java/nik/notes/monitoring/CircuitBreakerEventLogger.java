package nik.notes.monitoring;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * CircuitBreaker 상태 전이 이벤트 로거
 *
 * <h3>기록 대상</h3>
 *
 * <ul>
 *   <li>상태 전이 (CLOSED→OPEN, OPEN→HALF_OPEN, HALF_OPEN→CLOSED): WARN
 *   <li>호출 거부 (OPEN 중 fast-fail): DEBUG
 * </ul>
 *
 * <p>cacheStore / generationBackend / weatherContext 세 브레이커 모두 레지스트리에 등록되므로 여기서 일괄 구독합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CircuitBreakerEventLogger {

  private final CircuitBreakerRegistry circuitBreakerRegistry;

  @PostConstruct
  void registerEventListeners() {
    circuitBreakerRegistry.getAllCircuitBreakers().forEach(this::registerListeners);

    circuitBreakerRegistry
        .getEventPublisher()
        .onEntryAdded(event -> registerListeners(event.getAddedEntry()));
  }

  private void registerListeners(CircuitBreaker cb) {
    cb.getEventPublisher()
        .onStateTransition(
            event ->
                log.warn(
                    "[CircuitBreaker:{}] State transition: {} → {}",
                    event.getCircuitBreakerName(),
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState()))
        .onCallNotPermitted(
            event ->
                log.debug("[CircuitBreaker:{}] Call not permitted", event.getCircuitBreakerName()));
  }
}

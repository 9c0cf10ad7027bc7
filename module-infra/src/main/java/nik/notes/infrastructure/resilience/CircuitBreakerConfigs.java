package nik.notes.infrastructure.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import java.time.Duration;
import nik.notes.error.exception.marker.CircuitBreakerIgnoreMarker;

/**
 * 의존성 어댑터용 Resilience4j 서킷 브레이커 설정
 *
 * <h3>연속 실패 기반 브레이커</h3>
 *
 * <ul>
 *   <li>COUNT_BASED 윈도우 크기 = 최소 호출 수 = F, 실패율 임계치 100% → F회 연속 실패 시 OPEN
 *   <li>OPEN 유지 시간 T 후 자동으로 HALF_OPEN 전환 (health()가 프로빙 구간을 볼 수 있도록)
 *   <li>HALF_OPEN 허용 호출 1회: 동시 호출자 중 하나만 permit을 얻고 나머지는 CallNotPermitted
 *   <li>프로브 성공 → CLOSED, 실패 → 다시 T 동안 OPEN
 *   <li>{@link CircuitBreakerIgnoreMarker} 예외는 집계에서 제외
 * </ul>
 */
public final class CircuitBreakerConfigs {

  private CircuitBreakerConfigs() {}

  public static CircuitBreakerConfig consecutiveFailures(int failureThreshold, Duration openDuration) {
    if (failureThreshold <= 0) {
      throw new IllegalArgumentException("failureThreshold must be positive: " + failureThreshold);
    }
    return CircuitBreakerConfig.custom()
        .slidingWindowType(SlidingWindowType.COUNT_BASED)
        .slidingWindowSize(failureThreshold)
        .minimumNumberOfCalls(failureThreshold)
        .failureRateThreshold(100.0f)
        .waitDurationInOpenState(openDuration)
        .automaticTransitionFromOpenToHalfOpenEnabled(true)
        .permittedNumberOfCallsInHalfOpenState(1)
        .ignoreException(e -> e instanceof CircuitBreakerIgnoreMarker)
        .build();
  }
}

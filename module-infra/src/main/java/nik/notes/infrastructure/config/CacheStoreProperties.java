package nik.notes.infrastructure.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 캐시 저장소 어댑터 설정
 *
 * <pre>{@code
 * cache:
 *   store:
 *     enabled: true
 *     operation-timeout: 800ms     # Redis 호출별 타임아웃
 *     health-check-interval: 5s    # ping 최소 간격
 *     failure-threshold: 5         # F: 연속 실패 → OPEN
 *     open-duration: 30s           # T: OPEN 유지 시간
 * }</pre>
 */
@ConfigurationProperties(prefix = "cache.store")
public record CacheStoreProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("800ms") Duration operationTimeout,
    @DefaultValue("5s") Duration healthCheckInterval,
    @DefaultValue("5") int failureThreshold,
    @DefaultValue("30s") Duration openDuration) {

  public CacheStoreProperties {
    requirePositive(operationTimeout, "cache.store.operation-timeout");
    requirePositive(healthCheckInterval, "cache.store.health-check-interval");
    requirePositive(openDuration, "cache.store.open-duration");
    if (failureThreshold <= 0) {
      throw new IllegalArgumentException(
          "cache.store.failure-threshold must be positive, got: " + failureThreshold);
    }
  }

  static void requirePositive(Duration value, String name) {
    if (value == null || value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive, got: " + value);
    }
  }
}

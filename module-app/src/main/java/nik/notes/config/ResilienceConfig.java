package nik.notes.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import nik.notes.infrastructure.config.CacheStoreProperties;
import nik.notes.infrastructure.config.GeminiProperties;
import nik.notes.infrastructure.config.WeatherProperties;
import nik.notes.infrastructure.resilience.CircuitBreakerConfigs;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 의존성별 서킷 브레이커
 *
 * <p>각 어댑터는 자기 브레이커만 봅니다. 전역 "시스템 헬스" 플래그는 두지 않습니다. 인스턴스는 레지스트리에 등록되어 {@link
 * nik.notes.monitoring.CircuitBreakerEventLogger}와 actuator에서 보입니다.
 */
@Configuration
public class ResilienceConfig {

  public static final String CACHE_STORE = "cacheStore";
  public static final String GENERATION_BACKEND = "generationBackend";
  public static final String WEATHER_CONTEXT = "weatherContext";

  @Bean
  public CircuitBreaker cacheStoreCircuitBreaker(
      CircuitBreakerRegistry registry, CacheStoreProperties properties) {
    return registry.circuitBreaker(
        CACHE_STORE,
        CircuitBreakerConfigs.consecutiveFailures(
            properties.failureThreshold(), properties.openDuration()));
  }

  @Bean
  public CircuitBreaker generationCircuitBreaker(
      CircuitBreakerRegistry registry, GeminiProperties properties) {
    return registry.circuitBreaker(
        GENERATION_BACKEND,
        CircuitBreakerConfigs.consecutiveFailures(
            properties.failureThreshold(), properties.openDuration()));
  }

  @Bean
  public CircuitBreaker weatherCircuitBreaker(
      CircuitBreakerRegistry registry, WeatherProperties properties) {
    return registry.circuitBreaker(
        WEATHER_CONTEXT,
        CircuitBreakerConfigs.consecutiveFailures(
            properties.failureThreshold(), properties.openDuration()));
  }
}

package nik.notes.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import nik.notes.core.domain.model.SuggestionList;
import nik.notes.core.port.out.CacheBackend;
import nik.notes.infrastructure.cache.CacheEnvelopeCodec;
import nik.notes.infrastructure.cache.CacheStoreAdapter;
import nik.notes.infrastructure.concurrency.SingleFlightCoordinator;
import nik.notes.infrastructure.config.CacheStoreProperties;
import nik.notes.infrastructure.config.RateLimitProperties;
import nik.notes.infrastructure.config.SingleFlightProperties;
import nik.notes.infrastructure.executor.DefaultLogicExecutor;
import nik.notes.infrastructure.executor.LogicExecutor;
import nik.notes.infrastructure.executor.TaskContext;
import nik.notes.infrastructure.executor.strategy.ExceptionTranslator;
import nik.notes.infrastructure.ratelimit.FixedWindowRateLimiter;
import nik.notes.infrastructure.ratelimit.RateLimiter;
import nik.notes.infrastructure.redis.RedissonCacheBackend;
import nik.notes.infrastructure.redis.UnavailableCacheBackend;
import nik.notes.infrastructure.redis.script.LuaScriptProvider;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 캐시 저장소 + 캐시 위에 얹히는 컴포넌트(single-flight, rate limiter) 조립
 *
 * <h3>백엔드 선택</h3>
 *
 * <ul>
 *   <li>{@code cache.store.enabled=true} 이고 Redisson 클라이언트 생성 성공 → {@link RedissonCacheBackend}
 *   <li>그 외 → {@link UnavailableCacheBackend} (ping=false, 모든 요청이 캐시를 우회)
 * </ul>
 */
@Slf4j
@Configuration
public class CacheStoreConfig {

  @Bean
  public CacheBackend cacheBackend(
      CacheStoreProperties properties,
      ObjectProvider<RedissonClient> redissonClient,
      LogicExecutor executor) {
    if (!properties.enabled()) {
      log.info("[CacheStore] Disabled by configuration, running without shared cache");
      return new UnavailableCacheBackend();
    }
    return executor.executeOrCatch(
        () -> {
          RedissonClient client = redissonClient.getObject();
          return new RedissonCacheBackend(
              client,
              new LuaScriptProvider(client),
              new DefaultLogicExecutor(ExceptionTranslator.forCacheStore()),
              properties.operationTimeout());
        },
        e -> {
          log.warn(
              "[CacheStore] Redis client unavailable, running without shared cache: {}",
              e.toString());
          return new UnavailableCacheBackend();
        },
        TaskContext.of("CacheStore", "createBackend"));
  }

  @Bean
  public CacheStoreAdapter cacheStoreAdapter(
      CacheBackend cacheBackend,
      @Qualifier("cacheStoreCircuitBreaker") CircuitBreaker circuitBreaker,
      ObjectMapper objectMapper,
      LogicExecutor executor,
      Clock clock,
      CacheStoreProperties properties,
      MeterRegistry meterRegistry) {
    return new CacheStoreAdapter(
        cacheBackend,
        circuitBreaker,
        new CacheEnvelopeCodec(objectMapper, executor),
        new DefaultLogicExecutor(ExceptionTranslator.forCacheStore()),
        clock,
        properties.healthCheckInterval(),
        meterRegistry);
  }

  @Bean
  public SingleFlightCoordinator<SuggestionList> suggestionSingleFlight(
      CacheStoreAdapter cacheStoreAdapter,
      @Qualifier("generationTaskExecutor") ThreadPoolTaskExecutor generationTaskExecutor,
      SingleFlightProperties properties) {
    return new SingleFlightCoordinator<>(cacheStoreAdapter, generationTaskExecutor, properties);
  }

  @Bean
  public RateLimiter rateLimiter(
      CacheStoreAdapter cacheStoreAdapter,
      RateLimitProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    return new FixedWindowRateLimiter(cacheStoreAdapter, properties, clock, meterRegistry);
  }
}

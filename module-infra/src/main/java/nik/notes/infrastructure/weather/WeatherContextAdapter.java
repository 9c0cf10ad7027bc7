package nik.notes.infrastructure.weather;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import nik.notes.core.domain.model.CapabilityState;
import nik.notes.core.domain.model.CapabilityStatus;
import nik.notes.core.domain.model.WeatherSnapshot;
import nik.notes.core.port.out.WeatherBackend;
import nik.notes.infrastructure.cache.CacheStoreAdapter;
import nik.notes.infrastructure.config.WeatherProperties;
import nik.notes.infrastructure.executor.LogicExecutor;
import nik.notes.infrastructure.executor.TaskContext;

/**
 * 보조 컨텍스트(날씨) 어댑터
 *
 * <h3>동작</h3>
 *
 * <ol>
 *   <li>API 키 미설정 → 즉시 empty (capability UNAVAILABLE)
 *   <li>캐시 조회 {@code weather:<destination>:<startDate|current>:<units>}
 *   <li>브레이커를 거쳐 외부 조회, 성공 시 캐시에 {@code cache-ttl} 동안 저장
 *   <li>모든 실패는 empty. 날씨는 요청을 실패시키지 않는다
 * </ol>
 */
@Slf4j
public class WeatherContextAdapter {

  private static final String COMPONENT = "WeatherContext";
  private static final String KEY_PREFIX = "weather:";

  private final WeatherBackend backend;
  private final CircuitBreaker circuitBreaker;
  private final CacheStoreAdapter cache;
  private final ObjectMapper objectMapper;
  private final WeatherProperties properties;
  private final LogicExecutor executor;
  private final Clock clock;
  private final AtomicReference<CapabilityState> capability;

  public WeatherContextAdapter(
      WeatherBackend backend,
      CircuitBreaker circuitBreaker,
      CacheStoreAdapter cache,
      ObjectMapper objectMapper,
      WeatherProperties properties,
      LogicExecutor executor,
      Clock clock) {
    this.backend = backend;
    this.circuitBreaker = circuitBreaker;
    this.cache = cache;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.executor = executor;
    this.clock = clock;
    this.capability = new AtomicReference<>(new CapabilityState(currentStatus(), clock.instant()));
    circuitBreaker.getEventPublisher().onStateTransition(event -> capability());
  }

  public Optional<WeatherSnapshot> lookup(String destination, LocalDate startDate) {
    if (!properties.isConfigured() || destination == null || destination.isBlank()) {
      return Optional.empty();
    }
    String key = cacheKey(destination, startDate);
    boolean cacheUsable = cache.health();

    if (cacheUsable) {
      Optional<WeatherSnapshot> cached = cache.get(key).flatMap(bytes -> decode(key, bytes));
      if (cached.isPresent()) {
        return cached;
      }
    }

    Optional<WeatherSnapshot> fetched =
        executor.executeOrDefault(
            () ->
                circuitBreaker.executeSupplier(
                    () -> backend.fetch(destination, startDate, properties.timeout())),
            Optional.empty(),
            TaskContext.of(COMPONENT, "fetch", destination));

    if (fetched.isPresent() && cacheUsable) {
      executor.executeOrDefault(
          () -> cache.set(key, objectMapper.writeValueAsBytes(fetched.get()), properties.cacheTtl()),
          false,
          TaskContext.of(COMPONENT, "store", destination));
    }
    return fetched;
  }

  /** 상태가 바뀐 경우에만 {@code since}를 갱신한다. */
  public CapabilityState capability() {
    CapabilityStatus status = currentStatus();
    return capability.updateAndGet(
        previous ->
            previous.status() == status ? previous : new CapabilityState(status, clock.instant()));
  }

  private CapabilityStatus currentStatus() {
    if (!properties.isConfigured()) {
      return CapabilityStatus.UNAVAILABLE;
    }
    return switch (circuitBreaker.getState()) {
      case OPEN, FORCED_OPEN -> CapabilityStatus.UNAVAILABLE;
      case HALF_OPEN -> CapabilityStatus.DEGRADED;
      default -> CapabilityStatus.AVAILABLE;
    };
  }

  private Optional<WeatherSnapshot> decode(String key, byte[] bytes) {
    return executor.executeOrDefault(
        () -> Optional.of(objectMapper.readValue(bytes, WeatherSnapshot.class)),
        Optional.empty(),
        TaskContext.of(COMPONENT, "decode", key));
  }

  private String cacheKey(String destination, LocalDate startDate) {
    String normalized = destination.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    return KEY_PREFIX
        + normalized
        + ":"
        + (startDate == null ? "current" : startDate.toString())
        + ":"
        + properties.units();
  }
}

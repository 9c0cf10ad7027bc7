package nik.notes.infrastructure.cache;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import nik.notes.core.domain.model.CacheEntry;
import nik.notes.core.domain.model.CapabilityState;
import nik.notes.core.domain.model.CapabilityStatus;
import nik.notes.core.port.out.CacheBackend;
import nik.notes.infrastructure.executor.LogicExecutor;
import nik.notes.infrastructure.executor.TaskContext;
import nik.notes.infrastructure.util.LogMasking;

/**
 * 캐시 저장소 어댑터 (서킷 브레이커 + 만료 재검증 + 헬스 체크)
 *
 * <h3>서킷 브레이커 상태별 동작</h3>
 *
 * <ul>
 *   <li><b>CLOSED</b>: 백엔드 호출. 실패/타임아웃은 연속 실패 카운트에 누적
 *   <li><b>OPEN</b>: 네트워크 호출 없이 즉시 단락 (get → empty, set → no-op)
 *   <li><b>HALF_OPEN</b>: 단 하나의 프로브 호출만 통과 (브레이커 내부 CAS). 나머지 호출자는 OPEN과 동일
 * </ul>
 *
 * <h3>헬스 체크</h3>
 *
 * <p>{@link #health()}는 브레이커가 OPEN이거나 최근 ping이 실패했으면 false입니다. ping은 {@code healthCheckInterval}마다
 * 최대 1회, CAS에 성공한 호출자 하나만 수행합니다.
 *
 * <h3>CapabilityState</h3>
 *
 * <p>CLOSED → AVAILABLE, HALF_OPEN → DEGRADED, OPEN 또는 ping 실패 → UNAVAILABLE. 상태는 이 어댑터만 갱신합니다.
 *
 * <p>어떤 메서드도 백엔드 장애를 호출자에게 던지지 않습니다.
 */
@Slf4j
public class CacheStoreAdapter {

  private static final String COMPONENT = "CacheStore";
  private static final long NEVER = -1L;

  private final CacheBackend backend;
  private final CircuitBreaker circuitBreaker;
  private final CacheEnvelopeCodec codec;
  private final LogicExecutor executor;
  private final Clock clock;
  private final long healthCheckIntervalMillis;
  private final MeterRegistry meterRegistry;

  private final AtomicLong lastPingAt = new AtomicLong(NEVER);
  private volatile boolean lastPingHealthy = true;
  private final AtomicReference<CapabilityState> capability;

  public CacheStoreAdapter(
      CacheBackend backend,
      CircuitBreaker circuitBreaker,
      CacheEnvelopeCodec codec,
      LogicExecutor executor,
      Clock clock,
      Duration healthCheckInterval,
      MeterRegistry meterRegistry) {
    this.backend = backend;
    this.circuitBreaker = circuitBreaker;
    this.codec = codec;
    this.executor = executor;
    this.clock = clock;
    this.healthCheckIntervalMillis = healthCheckInterval.toMillis();
    this.meterRegistry = meterRegistry;
    this.capability = new AtomicReference<>(CapabilityState.available(clock.instant()));
    circuitBreaker.getEventPublisher().onStateTransition(event -> refreshCapability());
  }

  /**
   * 캐시 조회. 만료되었거나 디코딩할 수 없는 엔트리, 백엔드 장애, 단락은 모두 empty.
   *
   * @return 저장 시 넘긴 payload
   */
  public Optional<byte[]> get(String key) {
    Optional<byte[]> raw = guarded("get", key, () -> backend.get(key), Optional.empty());
    return raw.flatMap(bytes -> codec.decode(key, bytes))
        .filter(entry -> key.equals(entry.key()))
        .filter(entry -> !entry.isExpired(clock.instant()))
        .map(CacheEntry::payload);
  }

  /**
   * 캐시 저장
   *
   * @return 저장 성공 여부 (단락/장애 시 false)
   */
  public boolean set(String key, byte[] payload, Duration ttl) {
    CacheEntry entry = new CacheEntry(key, payload, clock.instant(), ttl);
    byte[] encoded = codec.encode(entry);
    return guarded(
        "set",
        key,
        () -> {
          backend.set(key, encoded, ttlSeconds(ttl));
          return true;
        },
        false);
  }

  public boolean delete(String key) {
    return guarded("delete", key, () -> backend.delete(key), false);
  }

  /** Single-flight 분산 리스 획득 시도 (SET NX + TTL). */
  public LeaseOutcome tryAcquireLease(String key, String token, Duration ttl) {
    Boolean acquired =
        guarded(
            "acquireLease",
            key,
            () -> backend.setIfAbsent(key, token.getBytes(StandardCharsets.UTF_8), ttlSeconds(ttl)),
            null);
    if (acquired == null) {
      return LeaseOutcome.UNAVAILABLE;
    }
    return acquired ? LeaseOutcome.ACQUIRED : LeaseOutcome.HELD_ELSEWHERE;
  }

  /** 자신이 가진 리스만 해제. 실패해도 TTL로 자연 만료된다. */
  public void releaseLease(String key, String token) {
    guarded(
        "releaseLease",
        key,
        () -> backend.deleteIfEquals(key, token.getBytes(StandardCharsets.UTF_8)),
        false);
  }

  /**
   * 고정 윈도우 카운터 원자 증가
   *
   * @return 증가 후 값, 캐시를 쓸 수 없으면 empty
   */
  public OptionalLong incrementWindow(String key, Duration window) {
    Long count =
        guarded(
            "incrementWindow", key, () -> backend.incrementWindow(key, window.toMillis()), null);
    return count == null ? OptionalLong.empty() : OptionalLong.of(count);
  }

  /**
   * 캐시 사용 가능 여부
   *
   * <p>브레이커가 호출을 막고 있으면 ping 없이 false. 그 외에는 주기가 지났을 때 한 호출자만 ping을 수행하고, 나머지는 직전 결과를 읽습니다.
   */
  public boolean health() {
    if (isShortCircuited()) {
      return false;
    }
    maybePing();
    return lastPingHealthy;
  }

  public CapabilityState capability() {
    return refreshCapability();
  }

  public CircuitBreaker.State circuitState() {
    return circuitBreaker.getState();
  }

  private void maybePing() {
    long now = clock.millis();
    long last = lastPingAt.get();
    if (last != NEVER && now - last < healthCheckIntervalMillis) {
      return;
    }
    if (!lastPingAt.compareAndSet(last, now)) {
      return;
    }
    boolean healthy =
        executor.executeOrDefault(backend::ping, false, TaskContext.of(COMPONENT, "ping"));
    if (healthy != lastPingHealthy) {
      if (healthy) {
        log.info("[{}] Ping recovered", COMPONENT);
      } else {
        log.warn("[{}] Ping failed, bypassing cache until next successful ping", COMPONENT);
      }
    }
    lastPingHealthy = healthy;
    refreshCapability();
  }

  private boolean isShortCircuited() {
    CircuitBreaker.State state = circuitBreaker.getState();
    return state == CircuitBreaker.State.OPEN || state == CircuitBreaker.State.FORCED_OPEN;
  }

  private CapabilityState refreshCapability() {
    CapabilityStatus status = currentStatus();
    Instant now = clock.instant();
    return capability.updateAndGet(
        previous -> previous.status() == status ? previous : new CapabilityState(status, now));
  }

  private CapabilityStatus currentStatus() {
    if (isShortCircuited() || !lastPingHealthy) {
      return CapabilityStatus.UNAVAILABLE;
    }
    if (circuitBreaker.getState() == CircuitBreaker.State.HALF_OPEN) {
      return CapabilityStatus.DEGRADED;
    }
    return CapabilityStatus.AVAILABLE;
  }

  /** 브레이커를 거쳐 백엔드를 호출하고, 모든 실패를 fallback으로 흡수한다. */
  private <T> T guarded(String operation, String key, Supplier<T> call, T fallback) {
    String maskedKey = LogMasking.maskKey(key);
    return executor.executeOrCatch(
        () -> circuitBreaker.executeSupplier(call),
        e -> onFailure(operation, maskedKey, e, fallback),
        TaskContext.of(COMPONENT, operation, maskedKey));
  }

  private <T> T onFailure(String operation, String maskedKey, Throwable e, T fallback) {
    if (e instanceof CallNotPermittedException
        || e.getCause() instanceof CallNotPermittedException) {
      Counter.builder("cache.store.shortcircuit")
          .tag("operation", operation)
          .register(meterRegistry)
          .increment();
      log.debug("[{}] Short-circuited {} for {}", COMPONENT, operation, maskedKey);
    } else {
      log.warn("[{}] {} failed for {}: {}", COMPONENT, operation, maskedKey, e.getMessage());
    }
    return fallback;
  }

  private static long ttlSeconds(Duration ttl) {
    long seconds = ttl.getSeconds() + (ttl.getNano() > 0 ? 1 : 0);
    return Math.max(1, seconds);
  }
}

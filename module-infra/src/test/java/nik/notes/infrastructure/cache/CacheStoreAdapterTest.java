package nik.notes.infrastructure.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import nik.notes.core.domain.model.CapabilityStatus;
import nik.notes.infrastructure.support.CacheStoreFixtures;
import nik.notes.infrastructure.support.FakeCacheBackend;
import nik.notes.infrastructure.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("CacheStoreAdapter")
class CacheStoreAdapterTest {

  private static final String KEY = "ai_suggestions:0123456789abcdef0123456789abcdef";
  private static final byte[] PAYLOAD = "payload".getBytes(StandardCharsets.UTF_8);

  private FakeCacheBackend backend;
  private MutableClock clock;

  @BeforeEach
  void setUp() {
    backend = new FakeCacheBackend();
    clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
  }

  @Nested
  @DisplayName("get / set")
  class ReadWrite {

    @Test
    @DisplayName("저장한 payload를 그대로 돌려준다")
    void roundTrip() {
      CacheStoreAdapter adapter = CacheStoreFixtures.adapter(backend, clock);

      assertThat(adapter.set(KEY, PAYLOAD, Duration.ofHours(24))).isTrue();

      assertThat(adapter.get(KEY)).hasValueSatisfying(v -> assertThat(v).isEqualTo(PAYLOAD));
    }

    @Test
    @DisplayName("TTL이 지난 엔트리는 저장소에 남아 있어도 miss")
    void expiredEntryIsAbsent() {
      CacheStoreAdapter adapter = CacheStoreFixtures.adapter(backend, clock);
      adapter.set(KEY, PAYLOAD, Duration.ofMinutes(5));

      clock.advance(Duration.ofMinutes(5).plusMillis(1));

      assertThat(backend.contains(KEY)).isTrue();
      assertThat(adapter.get(KEY)).isEmpty();
    }

    @Test
    @DisplayName("디코딩할 수 없는 값은 miss")
    void corruptValueIsMiss() {
      CacheStoreAdapter adapter = CacheStoreFixtures.adapter(backend, clock);
      backend.putRaw(KEY, "not-json".getBytes(StandardCharsets.UTF_8));

      assertThat(adapter.get(KEY)).isEmpty();
    }

    @Test
    @DisplayName("다른 키로 저장된 envelope은 miss")
    void keyMismatchIsMiss() {
      CacheStoreAdapter adapter = CacheStoreFixtures.adapter(backend, clock);
      backend.putRaw(KEY, envelopeFor("ai_suggestions:other"));

      assertThat(adapter.get(KEY)).isEmpty();
    }

    @Test
    @DisplayName("백엔드 장애는 예외 없이 empty / false")
    void backendFailureIsAbsorbed() {
      CacheStoreAdapter adapter = CacheStoreFixtures.adapter(backend, clock);
      backend.failing(true);

      assertThat(adapter.get(KEY)).isEmpty();
      assertThat(adapter.set(KEY, PAYLOAD, Duration.ofHours(1))).isFalse();
      assertThat(adapter.delete(KEY)).isFalse();
      assertThat(adapter.incrementWindow(KEY, Duration.ofMinutes(1))).isEmpty();
    }

    private byte[] envelopeFor(String key) {
      FakeCacheBackend other = new FakeCacheBackend();
      CacheStoreAdapter writer = CacheStoreFixtures.adapter(other, clock);
      writer.set(key, PAYLOAD, Duration.ofHours(1));
      return other.get(key).orElseThrow();
    }
  }

  @Nested
  @DisplayName("lease")
  class Lease {

    @Test
    @DisplayName("첫 획득은 ACQUIRED, 다음은 HELD_ELSEWHERE, 해제 후 다시 ACQUIRED")
    void acquireAndRelease() {
      CacheStoreAdapter adapter = CacheStoreFixtures.adapter(backend, clock);
      String lease = "{single-flight}:" + KEY;

      assertThat(adapter.tryAcquireLease(lease, "a", Duration.ofSeconds(30)))
          .isEqualTo(LeaseOutcome.ACQUIRED);
      assertThat(adapter.tryAcquireLease(lease, "b", Duration.ofSeconds(30)))
          .isEqualTo(LeaseOutcome.HELD_ELSEWHERE);

      adapter.releaseLease(lease, "b");
      assertThat(adapter.tryAcquireLease(lease, "b", Duration.ofSeconds(30)))
          .isEqualTo(LeaseOutcome.HELD_ELSEWHERE);

      adapter.releaseLease(lease, "a");
      assertThat(adapter.tryAcquireLease(lease, "b", Duration.ofSeconds(30)))
          .isEqualTo(LeaseOutcome.ACQUIRED);
    }

    @Test
    @DisplayName("캐시 장애 시 UNAVAILABLE")
    void unavailableOnFailure() {
      CacheStoreAdapter adapter = CacheStoreFixtures.adapter(backend, clock);
      backend.failing(true);

      assertThat(adapter.tryAcquireLease("{single-flight}:k", "a", Duration.ofSeconds(30)))
          .isEqualTo(LeaseOutcome.UNAVAILABLE);
    }
  }

  @Nested
  @DisplayName("health")
  class Health {

    @Test
    @DisplayName("ping 실패 시 false, capability UNAVAILABLE")
    void pingFailure() {
      CacheStoreAdapter adapter = CacheStoreFixtures.adapter(backend, clock);
      backend.pingHealthy(false);

      assertThat(adapter.health()).isFalse();
      assertThat(adapter.capability().status()).isEqualTo(CapabilityStatus.UNAVAILABLE);

      backend.pingHealthy(true);
      assertThat(adapter.health()).isTrue();
      assertThat(adapter.capability().status()).isEqualTo(CapabilityStatus.AVAILABLE);
    }

    @Test
    @DisplayName("health check 주기 안에서는 직전 ping 결과를 재사용")
    void pingIsThrottled() {
      CacheStoreAdapter adapter =
          CacheStoreFixtures.adapter(
              backend, clock, 5, Duration.ofSeconds(30), Duration.ofSeconds(5));

      assertThat(adapter.health()).isTrue();
      backend.pingHealthy(false);
      assertThat(adapter.health()).isTrue();

      clock.advance(Duration.ofSeconds(5));
      assertThat(adapter.health()).isFalse();
    }
  }

  @Nested
  @DisplayName("circuit breaker")
  class Breaker {

    private static final int FAILURES = 3;
    private static final Duration OPEN_FOR = Duration.ofMillis(300);

    private CacheStoreAdapter adapter;

    @BeforeEach
    void setUp() {
      adapter =
          CacheStoreFixtures.adapter(
              backend, Clock.systemUTC(), FAILURES, OPEN_FOR, Duration.ZERO);
    }

    @Test
    @DisplayName("F회 연속 실패 후 OPEN, 이후 호출은 백엔드에 닿지 않는다")
    void opensAfterConsecutiveFailures() {
      backend.failing(true);
      for (int i = 0; i < FAILURES; i++) {
        adapter.get(KEY);
      }

      assertThat(adapter.circuitState()).isEqualTo(CircuitBreaker.State.OPEN);
      assertThat(adapter.health()).isFalse();

      int callsWhenOpened = backend.getCalls();
      for (int i = 0; i < 10; i++) {
        assertThat(adapter.get(KEY)).isEmpty();
      }
      assertThat(backend.getCalls()).isEqualTo(callsWhenOpened);
    }

    @Test
    @DisplayName("타임아웃도 실패로 집계된다")
    void timeoutsCountAsFailures() {
      backend.timingOut(true);
      for (int i = 0; i < FAILURES; i++) {
        adapter.set(KEY, PAYLOAD, Duration.ofMinutes(1));
      }

      assertThat(adapter.circuitState()).isEqualTo(CircuitBreaker.State.OPEN);
    }

    @Test
    @DisplayName("T 경과 후 동시 호출 중 정확히 하나만 프로브, 성공하면 CLOSED")
    void exactlyOneProbe() throws Exception {
      backend.failing(true);
      for (int i = 0; i < FAILURES; i++) {
        adapter.get(KEY);
      }
      backend.failing(false);
      backend.latencyMillis(200);

      await()
          .atMost(Duration.ofSeconds(3))
          .until(() -> adapter.circuitState() == CircuitBreaker.State.HALF_OPEN);
      assertThat(adapter.capability().status()).isEqualTo(CapabilityStatus.DEGRADED);

      int before = backend.getCalls();
      int callers = 16;
      ExecutorService pool = Executors.newFixedThreadPool(callers);
      CountDownLatch start = new CountDownLatch(1);
      List<Future<Optional<byte[]>>> results = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        results.add(
            pool.submit(
                () -> {
                  start.await();
                  return adapter.get(KEY);
                }));
      }
      start.countDown();
      for (Future<Optional<byte[]>> result : results) {
        assertThat(result.get(5, TimeUnit.SECONDS)).isEmpty();
      }
      pool.shutdown();

      assertThat(backend.getCalls() - before).isEqualTo(1);
      assertThat(adapter.circuitState()).isEqualTo(CircuitBreaker.State.CLOSED);
      assertThat(adapter.capability().status()).isEqualTo(CapabilityStatus.AVAILABLE);
    }

    @Test
    @DisplayName("프로브가 실패하면 다시 OPEN")
    void failedProbeReopens() {
      backend.failing(true);
      for (int i = 0; i < FAILURES; i++) {
        adapter.get(KEY);
      }

      await()
          .atMost(Duration.ofSeconds(3))
          .until(() -> adapter.circuitState() == CircuitBreaker.State.HALF_OPEN);
      adapter.get(KEY);

      assertThat(adapter.circuitState()).isEqualTo(CircuitBreaker.State.OPEN);
    }
  }
}

package nik.notes.infrastructure.concurrency;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import nik.notes.infrastructure.cache.CacheStoreAdapter;
import nik.notes.infrastructure.cache.LeaseOutcome;
import nik.notes.infrastructure.config.SingleFlightProperties;
import nik.notes.infrastructure.util.LogMasking;

/**
 * 키별 Single-flight 조정기 (프로세스 내 보장 + best-effort 분산)
 *
 * <h3>동작 흐름</h3>
 *
 * <ol>
 *   <li>ConcurrentHashMap.putIfAbsent로 Leader/Follower 결정 (프로세스 내 동시 생성 1회 보장)
 *   <li>Leader는 캐시가 살아 있으면 {@code {single-flight}:<key>} 리스를 SET NX로 시도
 *       <ul>
 *         <li>ACQUIRED / UNAVAILABLE: 직접 생성 (캐시 장애 시 프로세스 간 중복 생성 가능 - 허용)
 *         <li>HELD_ELSEWHERE: 다른 인스턴스가 생성 중 → 캐시 폴링, 리스가 풀리면 직접 생성
 *       </ul>
 *   <li>생성은 별도 Executor에서 실행되고 {@code generationTimeout}이 지나면 슬롯을 강제 해제, 대기자 전원에게 fallback 결과
 *   <li>Executor가 작업을 거부하면 즉시 fallback으로 슬롯을 정리한다
 *   <li>타임아웃된 생성은 중단하지 않는다. 늦게 끝난 결과는 task 내부에서 캐시에 기록된다
 * </ol>
 *
 * <h3>Follower 격리</h3>
 *
 * <p>Follower마다 독립된 Future({@code thenApply(identity())})에 타임아웃을 걸어, 한 Follower의 타임아웃이 공유 promise나 다른
 * Follower에 영향을 주지 않습니다.
 *
 * @param <T> 결과 타입
 */
@Slf4j
public class SingleFlightCoordinator<T> {

  static final String LEASE_PREFIX = "{single-flight}:";

  private final ConcurrentHashMap<String, InFlight<T>> inFlight = new ConcurrentHashMap<>();
  private final CacheStoreAdapter cache;
  private final Executor generationExecutor;
  private final Duration generationTimeout;
  private final Duration remoteWaitTimeout;
  private final Duration pollInterval;
  private final Duration leaseTtl;
  private final String instanceToken = UUID.randomUUID().toString();

  public SingleFlightCoordinator(
      CacheStoreAdapter cache, Executor generationExecutor, SingleFlightProperties properties) {
    this.cache = cache;
    this.generationExecutor = generationExecutor;
    this.generationTimeout = properties.generationTimeout();
    this.remoteWaitTimeout = properties.remoteWaitTimeout();
    this.pollInterval = properties.pollInterval();
    this.leaseTtl = properties.leaseTtl();
  }

  /**
   * 키당 한 번만 task를 실행하고 모든 호출자에게 같은 결과를 반환합니다.
   *
   * @param key 중복 제거 키
   * @param task 실제 작업 (늦게 끝나도 부수효과는 유지됨)
   * @param remoteLookup 다른 인스턴스가 만든 결과 조회 (보통 캐시 get)
   * @param fallback 타임아웃/실패 시 결과. 예외를 던지지 않아야 한다
   * @return task 결과 또는 fallback 결과
   */
  public T execute(
      String key, Supplier<T> task, Supplier<Optional<T>> remoteLookup, Supplier<T> fallback) {
    InFlight<T> mine = new InFlight<>(new CompletableFuture<>());
    InFlight<T> existing = inFlight.putIfAbsent(key, mine);

    if (existing != null) {
      log.debug("[SingleFlight] Joining in-flight generation for {}", LogMasking.maskKey(key));
      return await(existing, generationTimeout.plus(remoteWaitTimeout), fallback, key);
    }

    lead(key, mine, task, remoteLookup, fallback);
    return await(mine, generationTimeout.plus(remoteWaitTimeout), fallback, key);
  }

  /** 현재 진행 중인 키 수 (모니터링/테스트용) */
  public int inFlightCount() {
    return inFlight.size();
  }

  private void lead(
      String key,
      InFlight<T> mine,
      Supplier<T> task,
      Supplier<Optional<T>> remoteLookup,
      Supplier<T> fallback) {
    String leaseKey = LEASE_PREFIX + key;
    LeaseOutcome lease =
        cache.health()
            ? cache.tryAcquireLease(leaseKey, instanceToken, leaseTtl)
            : LeaseOutcome.UNAVAILABLE;

    if (lease == LeaseOutcome.HELD_ELSEWHERE) {
      RemoteWait<T> waited = awaitRemote(key, leaseKey, remoteLookup);
      if (waited.result() != null) {
        settle(key, mine, waited.result(), null, false);
        return;
      }
      if (waited.outcome() == LeaseOutcome.HELD_ELSEWHERE) {
        log.warn("[SingleFlight] Remote generation did not finish in time for {}", LogMasking.maskKey(key));
        settle(key, mine, fallback.get(), null, false);
        return;
      }
      lease = waited.outcome();
    }

    startGeneration(key, mine, task, fallback, lease == LeaseOutcome.ACQUIRED);
  }

  /**
   * 슬롯 타임아웃은 작업 제출 전에 건다. Executor가 호출 스레드에서 작업을 돌리더라도 대기자는 제시간에 fallback을 받는다.
   */
  private void startGeneration(
      String key, InFlight<T> mine, Supplier<T> task, Supplier<T> fallback, boolean leaseHeld) {
    CompletableFuture<T> slot = new CompletableFuture<>();
    slot.orTimeout(generationTimeout.toMillis(), TimeUnit.MILLISECONDS)
        .handle((value, error) -> error == null ? value : onGenerationFailure(key, error, fallback))
        .whenComplete((result, error) -> settle(key, mine, result, error, leaseHeld));

    try {
      CompletableFuture.supplyAsync(task, generationExecutor)
          .whenComplete(
              (value, error) -> {
                if (error == null) {
                  slot.complete(value);
                } else {
                  slot.completeExceptionally(error);
                }
              });
    } catch (RejectedExecutionException e) {
      slot.completeExceptionally(e);
    }
  }

  private T onGenerationFailure(String key, Throwable error, Supplier<T> fallback) {
    Throwable cause = unwrapCause(error);
    if (cause instanceof TimeoutException) {
      log.warn(
          "[SingleFlight] Generation exceeded {}ms for {}, releasing slot with fallback",
          generationTimeout.toMillis(),
          LogMasking.maskKey(key));
    } else {
      log.warn(
          "[SingleFlight] Generation failed for {}: {}", LogMasking.maskKey(key), cause.toString());
    }
    return fallback.get();
  }

  /** 슬롯을 먼저 비우고 결과를 전달한다. 이후 도착한 호출자는 새 생성을 시작한다. */
  private void settle(String key, InFlight<T> mine, T result, Throwable error, boolean leaseHeld) {
    inFlight.remove(key, mine);
    if (leaseHeld) {
      cache.releaseLease(LEASE_PREFIX + key, instanceToken);
    }
    if (error != null) {
      mine.promise().completeExceptionally(error);
    } else {
      mine.promise().complete(result);
    }
  }

  private T await(InFlight<T> entry, Duration timeout, Supplier<T> fallback, String key) {
    return entry
        .promise()
        .thenApply(Function.identity())
        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .exceptionally(
            e -> {
              log.warn(
                  "[SingleFlight] Waiter fell back for {}: {}",
                  LogMasking.maskKey(key),
                  unwrapCause(e).toString());
              return fallback.get();
            })
        .join();
  }

  /**
   * 다른 인스턴스의 결과를 폴링한다.
   *
   * <p>결과가 보이면 반환, 리스가 풀리면 직접 생성권을 가져오고(ACQUIRED), 캐시가 죽으면 UNAVAILABLE, 시간이 다 되면 HELD_ELSEWHERE.
   */
  private RemoteWait<T> awaitRemote(
      String key, String leaseKey, Supplier<Optional<T>> remoteLookup) {
    long deadline = System.nanoTime() + remoteWaitTimeout.toNanos();
    while (System.nanoTime() < deadline) {
      Optional<T> found = remoteLookup.get();
      if (found.isPresent()) {
        log.debug("[SingleFlight] Remote result found for {}", LogMasking.maskKey(key));
        return new RemoteWait<>(found.get(), LeaseOutcome.HELD_ELSEWHERE);
      }
      LeaseOutcome retry = cache.tryAcquireLease(leaseKey, instanceToken, leaseTtl);
      if (retry != LeaseOutcome.HELD_ELSEWHERE) {
        return new RemoteWait<>(null, retry);
      }
      if (!sleep(pollInterval)) {
        break;
      }
    }
    return new RemoteWait<>(null, LeaseOutcome.HELD_ELSEWHERE);
  }

  private static boolean sleep(Duration duration) {
    try {
      Thread.sleep(duration.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static Throwable unwrapCause(Throwable e) {
    Throwable current = e;
    while (current.getCause() != null
        && (current instanceof java.util.concurrent.CompletionException
            || current instanceof java.util.concurrent.ExecutionException)) {
      current = current.getCause();
    }
    return current;
  }

  private record InFlight<T>(CompletableFuture<T> promise) {}

  private record RemoteWait<T>(T result, LeaseOutcome outcome) {}
}

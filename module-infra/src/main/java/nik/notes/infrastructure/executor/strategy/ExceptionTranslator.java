package nik.notes.infrastructure.executor.strategy;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import nik.notes.error.exception.DependencyTimeoutException;
import nik.notes.error.exception.DependencyUnavailableException;
import nik.notes.error.exception.InternalSystemException;
import nik.notes.error.exception.StoreFailureException;
import nik.notes.error.exception.base.BaseException;
import nik.notes.infrastructure.executor.TaskContext;
import org.redisson.client.RedisTimeoutException;

/** 기술 예외를 도메인 예외로 변환하는 전략 */
@FunctionalInterface
public interface ExceptionTranslator {

  /**
   * @param e 원본 예외
   * @param context 작업 컨텍스트
   * @return 변환된 RuntimeException
   */
  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Error guard + async unwrap을 선행 적용하는 Decorator
   *
   * <ol>
   *   <li>Error → 즉시 rethrow
   *   <li>CompletionException/ExecutionException → 원본으로 unwrap
   *   <li>이미 BaseException이면 그대로 반환
   *   <li>나머지는 내부 translator에 위임
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = unwrapAsync(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      if (unwrapped instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      return inner.translate(unwrapped, context);
    };
  }

  /** 기본 변환기: 분류되지 않은 예외는 InternalSystemException */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new InternalSystemException(context.toTaskName(), unwrapped));
  }

  /**
   * 캐시 저장소(Redis) 변환기
   *
   * <ul>
   *   <li>타임아웃 → DependencyTimeoutException
   *   <li>브레이커 OPEN(CallNotPermitted) 및 그 외 → DependencyUnavailableException (cause 보존)
   * </ul>
   */
  static ExceptionTranslator forCacheStore() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (isTimeout(unwrapped)) {
            return new DependencyTimeoutException("cache-store:" + context.operation(), unwrapped);
          }
          if (unwrapped instanceof CallNotPermittedException) {
            return new DependencyUnavailableException("cache-store:circuit-open", unwrapped);
          }
          return new DependencyUnavailableException("cache-store:" + context.operation(), unwrapped);
        });
  }

  /** HTTP 기반 외부 API(생성 백엔드, 날씨) 변환기 */
  static ExceptionTranslator forRemoteCall(String dependency) {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (isTimeout(unwrapped)) {
            return new DependencyTimeoutException(dependency + ":" + context.operation(), unwrapped);
          }
          return new DependencyUnavailableException(dependency, unwrapped);
        });
  }

  /** 영속 저장소 변환기. 필수 의존성이므로 호출자에게 전파될 StoreFailureException으로 변환 */
  static ExceptionTranslator forDurableStore() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) ->
            new StoreFailureException("durable-store:" + context.operation(), unwrapped));
  }

  private static Throwable unwrapAsync(Throwable e) {
    Throwable current = e;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /** Reactor block()은 checked TimeoutException을 감싸서 던지므로 cause 체인까지 확인한다. */
  private static boolean isTimeout(Throwable e) {
    for (Throwable current = e; current != null; current = current.getCause()) {
      if (current instanceof TimeoutException || current instanceof RedisTimeoutException) {
        return true;
      }
      if (current.getCause() == current) {
        break;
      }
    }
    return false;
  }
}

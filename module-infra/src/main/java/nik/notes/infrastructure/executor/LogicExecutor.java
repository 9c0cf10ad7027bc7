package nik.notes.infrastructure.executor;

import java.util.function.Function;
import nik.notes.common.function.ThrowingRunnable;
import nik.notes.common.function.ThrowingSupplier;
import nik.notes.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 예외 처리 패턴을 추상화한 실행기
 *
 * <p>try-catch를 호출부에서 걷어내고, 비즈니스 로직은 별도 메서드로 분리해 메서드 참조({@code this::method})로 넘깁니다.
 *
 * <h3>지원 패턴</h3>
 *
 * <ol>
 *   <li><b>try-catch-throw</b> (예외 변환 후 재전파) - {@link #execute}
 *   <li><b>try-catch-return</b> (기본값 반환) - {@link #executeOrDefault}
 *   <li><b>try-catch-recover</b> (번역된 예외로 복구) - {@link #executeOrCatch}
 *   <li><b>try-finally</b> (리소스 정리) - {@link #executeWithFinally}
 *   <li><b>다중 catch</b> (ExceptionTranslator 지정) - {@link #executeWithTranslation}
 * </ol>
 *
 * <h3>사용 예시</h3>
 *
 * <pre>{@code
 * Optional<byte[]> value = executor.executeOrDefault(
 *     () -> backend.get(key),
 *     Optional.empty(),
 *     TaskContext.of("CacheStore", "get", maskKey(key)));
 * }</pre>
 *
 * <p>{@link Error}는 어떤 패턴에서도 번역/복구 없이 그대로 전파됩니다.
 */
public interface LogicExecutor {

  /**
   * 예외를 RuntimeException으로 변환하여 전파
   *
   * @throws RuntimeException 기본 translator로 변환된 예외 (BaseException은 그대로)
   */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /** 예외 발생 시 기본값 반환 */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  /**
   * 예외 발생 시 번역된 예외를 받아 복구값 생성
   *
   * @param recovery 번역된 RuntimeException을 받는 복구 함수
   */
  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  void executeVoid(ThrowingRunnable task, TaskContext context);

  /** finally 블록은 성공/실패와 무관하게 정확히 1회 실행됩니다. */
  <T> T executeWithFinally(ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context);

  /** 지정한 translator로 예외를 변환하여 전파 */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}

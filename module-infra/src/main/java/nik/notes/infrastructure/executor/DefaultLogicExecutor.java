package nik.notes.infrastructure.executor;

import java.util.Objects;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import nik.notes.common.function.ThrowingRunnable;
import nik.notes.common.function.ThrowingSupplier;
import nik.notes.error.exception.InternalSystemException;
import nik.notes.error.exception.base.ClientBaseException;
import nik.notes.error.exception.base.ServerBaseException;
import nik.notes.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * LogicExecutor 기본 구현체
 *
 * <ul>
 *   <li><b>Error 즉시 rethrow</b>: VirtualMachineError 등은 번역 없이 전파
 *   <li><b>전파 경로 로깅</b>: Client 예외는 DEBUG, Server 예외는 WARN, 분류되지 않은 예외는 ERROR(stacktrace)
 *   <li><b>복구 경로</b>: executeOrCatch/executeOrDefault는 DEBUG만 남기고, 의미 있는 로그는 호출부 책임
 * </ul>
 */
@Slf4j
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String UNEXPECTED_TRANSLATOR_FAILURE =
      "Translator failed with unexpected Throwable";

  private final ExceptionTranslator translator;

  public DefaultLogicExecutor() {
    this(ExceptionTranslator.defaultTranslator());
  }

  public DefaultLogicExecutor(ExceptionTranslator translator) {
    this.translator = Objects.requireNonNull(translator, "translator");
  }

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithTranslation(task, translator, context);
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(task, e -> defaultValue, context);
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(recovery, "recovery");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      RuntimeException translated = translateSafe(translator, t, context);
      log.debug(
          "[Task:RECOVERED] {} errorType={}",
          context.toTaskName(),
          translated.getClass().getSimpleName());
      return recovery.apply(translated);
    }
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  @Override
  public <T> T executeWithFinally(
      ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context) {
    Objects.requireNonNull(finallyBlock, "finallyBlock");
    try {
      return execute(task, context);
    } finally {
      finallyBlock.run();
    }
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(customTranslator, "customTranslator");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      RuntimeException translated = translateSafe(customTranslator, t, context);
      logFailure(translated, context);
      throw translated;
    }
  }

  private static RuntimeException translateSafe(
      ExceptionTranslator translator, Throwable t, TaskContext context) {
    try {
      RuntimeException translated = translator.translate(t, context);
      return translated != null
          ? translated
          : new IllegalStateException(UNEXPECTED_TRANSLATOR_FAILURE, t);
    } catch (RuntimeException ex) {
      return ex;
    }
  }

  private static void logFailure(RuntimeException e, TaskContext context) {
    if (e instanceof ClientBaseException) {
      log.debug("[Task:FAILURE] {} {}", context.toTaskName(), e.getMessage());
    } else if (e instanceof ServerBaseException && !(e instanceof InternalSystemException)) {
      log.warn(
          "[Task:FAILURE] {} errorType={} message={}",
          context.toTaskName(),
          e.getClass().getSimpleName(),
          e.getMessage());
    } else {
      log.error("[Task:FAILURE] {}", context.toTaskName(), e);
    }
  }
}

package nik.notes.common.function;

@FunctionalInterface
public interface ThrowingRunnable {
  void run() throws Throwable;
}

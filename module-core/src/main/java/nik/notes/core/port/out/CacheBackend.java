package nik.notes.core.port.out;

import java.util.Optional;

/**
 * Port to the optional shared cache store.
 *
 * <p>Implemented by module-infra adapters (Redis via Redisson). Implementations must bound every
 * call with an explicit timeout and report failures as {@link
 * nik.notes.error.exception.DependencyUnavailableException} or {@link
 * nik.notes.error.exception.DependencyTimeoutException}; they never block indefinitely.
 */
public interface CacheBackend {

  Optional<byte[]> get(String key);

  void set(String key, byte[] value, long ttlSeconds);

  /**
   * Stores the value only if the key does not exist.
   *
   * @return true if this call created the key
   */
  boolean setIfAbsent(String key, byte[] value, long ttlSeconds);

  /**
   * Deletes the key only if its current value equals {@code expected}.
   *
   * @return true if the key was deleted
   */
  boolean deleteIfEquals(String key, byte[] expected);

  boolean delete(String key);

  /** Cheap liveness check. Never throws. */
  boolean ping();

  /**
   * Atomically increments a fixed-window counter, setting its expiry on the first increment.
   *
   * @param key window key (already includes the window start)
   * @param windowMillis window length used as the key's expiry
   * @return counter value after the increment
   */
  long incrementWindow(String key, long windowMillis);
}

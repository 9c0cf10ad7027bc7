package nik.notes.infrastructure.redis;

import java.util.Optional;
import nik.notes.core.port.out.CacheBackend;
import nik.notes.error.exception.DependencyUnavailableException;

/**
 * 캐시가 비활성화되었거나 Redis 클라이언트를 만들 수 없을 때 쓰는 백엔드
 *
 * <p>ping은 항상 false이므로 상위 어댑터는 캐시를 우회하며, 실제 호출이 들어오면 DependencyUnavailableException을 던집니다.
 */
public class UnavailableCacheBackend implements CacheBackend {

  private static final String DEPENDENCY = "cache-store:disabled";

  @Override
  public Optional<byte[]> get(String key) {
    throw new DependencyUnavailableException(DEPENDENCY);
  }

  @Override
  public void set(String key, byte[] value, long ttlSeconds) {
    throw new DependencyUnavailableException(DEPENDENCY);
  }

  @Override
  public boolean setIfAbsent(String key, byte[] value, long ttlSeconds) {
    throw new DependencyUnavailableException(DEPENDENCY);
  }

  @Override
  public boolean deleteIfEquals(String key, byte[] expected) {
    throw new DependencyUnavailableException(DEPENDENCY);
  }

  @Override
  public boolean delete(String key) {
    throw new DependencyUnavailableException(DEPENDENCY);
  }

  @Override
  public boolean ping() {
    return false;
  }

  @Override
  public long incrementWindow(String key, long windowMillis) {
    throw new DependencyUnavailableException(DEPENDENCY);
  }
}

package nik.notes.infrastructure.redis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import nik.notes.error.exception.DependencyUnavailableException;
import nik.notes.infrastructure.cache.CacheStoreAdapter;
import nik.notes.infrastructure.support.CacheStoreFixtures;
import nik.notes.infrastructure.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("UnavailableCacheBackend")
class UnavailableCacheBackendTest {

  private final UnavailableCacheBackend backend = new UnavailableCacheBackend();

  @Test
  @DisplayName("ping은 false, 나머지 연산은 DependencyUnavailable")
  void reportsUnavailable() {
    assertThat(backend.ping()).isFalse();
    assertThatThrownBy(() -> backend.get("k")).isInstanceOf(DependencyUnavailableException.class);
    assertThatThrownBy(() -> backend.set("k", new byte[0], 1))
        .isInstanceOf(DependencyUnavailableException.class);
  }

  @Test
  @DisplayName("어댑터는 캐시를 우회한다")
  void adapterBypassesCache() {
    CacheStoreAdapter adapter =
        CacheStoreFixtures.adapter(backend, new MutableClock(Instant.now()));

    assertThat(adapter.health()).isFalse();
    assertThat(adapter.set("k", new byte[] {1}, Duration.ofMinutes(1))).isFalse();
    assertThat(adapter.get("k")).isEmpty();
  }
}

package nik.notes.core.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached payload with its write time and time-to-live.
 *
 * <p>Expiry is passive: an entry is never served once {@code now > createdAt + ttl}, regardless of
 * whether the backing store has evicted it yet.
 */
public record CacheEntry(String key, byte[] payload, Instant createdAt, Duration ttl) {

  public Instant expiresAt() {
    return createdAt.plus(ttl);
  }

  public boolean isExpired(Instant now) {
    return now.isAfter(expiresAt());
  }
}

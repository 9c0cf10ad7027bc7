package nik.notes.core.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed, epoch-aligned counting window for one (route, identity) pair.
 *
 * @param counter calls counted so far in this window
 * @param windowStart start of the window, a multiple of {@code window} since the epoch
 * @param window window length
 */
public record RateWindow(long counter, Instant windowStart, Duration window) {

  public static Instant alignedStart(Instant now, Duration window) {
    long windowMillis = window.toMillis();
    long nowMillis = now.toEpochMilli();
    return Instant.ofEpochMilli(nowMillis - Math.floorMod(nowMillis, windowMillis));
  }

  public static RateWindow of(long counter, Instant now, Duration window) {
    return new RateWindow(counter, alignedStart(now, window), window);
  }

  public Instant windowEnd() {
    return windowStart.plus(window);
  }

  /** Seconds until this window closes, rounded up, never below 1. */
  public long retryAfterSeconds(Instant now) {
    long remainingMillis = Duration.between(now, windowEnd()).toMillis();
    long seconds = (remainingMillis + 999) / 1000;
    return Math.max(1, seconds);
  }
}

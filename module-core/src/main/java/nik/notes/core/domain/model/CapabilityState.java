package nik.notes.core.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Health of one dependency as seen by its adapter.
 *
 * <p>Owned by the adapter; transitions are driven by its circuit breaker and health probe only.
 *
 * @param status current status
 * @param since time of the last transition
 */
public record CapabilityState(CapabilityStatus status, Instant since) {

  public CapabilityState {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(since, "since");
  }

  public static CapabilityState available(Instant since) {
    return new CapabilityState(CapabilityStatus.AVAILABLE, since);
  }

  public static CapabilityState unavailable(Instant since) {
    return new CapabilityState(CapabilityStatus.UNAVAILABLE, since);
  }

  public boolean isUsable() {
    return status != CapabilityStatus.UNAVAILABLE;
  }
}

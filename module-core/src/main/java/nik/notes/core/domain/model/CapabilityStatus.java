package nik.notes.core.domain.model;

public enum CapabilityStatus {
  AVAILABLE,
  /** Being probed after a failure period. Treated as usable. */
  DEGRADED,
  UNAVAILABLE
}

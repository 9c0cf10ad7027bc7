package nik.notes.infrastructure.cache;

/** Result of trying to take a distributed single-flight lease. */
public enum LeaseOutcome {
  ACQUIRED,
  /** Another process holds the lease. */
  HELD_ELSEWHERE,
  /** Cache unreachable or circuit open; no cross-process exclusion this time. */
  UNAVAILABLE
}

package nik.notes.core.domain.model;

/**
 * Outcome of a rate limit check.
 *
 * @param allowed whether the call may proceed
 * @param remaining calls left in the current window (0 when rejected)
 * @param retryAfterSeconds seconds until the window resets (0 when allowed)
 */
public record RateLimitDecision(boolean allowed, long remaining, long retryAfterSeconds) {

  public static RateLimitDecision allowed(long remaining) {
    return new RateLimitDecision(true, Math.max(0, remaining), 0);
  }

  public static RateLimitDecision rejected(long retryAfterSeconds) {
    return new RateLimitDecision(false, 0, Math.max(1, retryAfterSeconds));
  }
}

package nik.notes.error.exception;

import lombok.Getter;
import nik.notes.error.CommonErrorCode;
import nik.notes.error.exception.base.ClientBaseException;
import nik.notes.error.exception.marker.CircuitBreakerIgnoreMarker;

/**
 * Rate Limit 초과 예외 (HTTP 429)
 *
 * <p>{@code retryAfterSeconds}는 응답의 {@code Retry-After} 헤더로 그대로 전달됩니다.
 */
@Getter
public class RateLimitExceededException extends ClientBaseException
    implements CircuitBreakerIgnoreMarker {

  private final long retryAfterSeconds;

  public RateLimitExceededException(long retryAfterSeconds) {
    super(CommonErrorCode.RATE_LIMIT_EXCEEDED, retryAfterSeconds);
    this.retryAfterSeconds = retryAfterSeconds;
  }
}

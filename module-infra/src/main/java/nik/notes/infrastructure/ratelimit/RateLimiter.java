package nik.notes.infrastructure.ratelimit;

import nik.notes.core.domain.model.RateLimitDecision;

/**
 * Rate Limiter 인터페이스
 *
 * <p>라우트별 규칙(L 요청 / W 윈도우)을 식별자 단위로 적용합니다. 구현체는 저장소 장애를 호출자에게 던지지 않습니다.
 */
public interface RateLimiter {

  /**
   * 호출 1회를 카운트하고 허용 여부를 반환
   *
   * @param route 규칙 이름 (예: "trip-create", "suggestion-regenerate")
   * @param identity 사용자 ID 또는 클라이언트 IP
   * @return 허용 또는 거부(retryAfterSeconds &gt; 0)
   */
  RateLimitDecision checkRateLimit(String route, String identity);
}

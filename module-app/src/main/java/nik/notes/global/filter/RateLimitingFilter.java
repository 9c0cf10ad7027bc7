package nik.notes.global.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import nik.notes.core.domain.model.RateLimitDecision;
import nik.notes.error.dto.ErrorResponse;
import nik.notes.error.exception.RateLimitExceededException;
import nik.notes.infrastructure.config.RateLimitProperties;
import nik.notes.infrastructure.executor.LogicExecutor;
import nik.notes.infrastructure.executor.TaskContext;
import nik.notes.infrastructure.ratelimit.RateLimiter;
import nik.notes.infrastructure.util.LogMasking;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Rate Limiting 필터 (OncePerRequestFilter)
 *
 * <p>Filter Chain 위치: MDCFilter → RateLimitingFilter
 *
 * <h4>처리 흐름</h4>
 *
 * <ol>
 *   <li>요청 → route 이름 매핑 (route별 규칙은 {@code ratelimit.rules.<route>})
 *   <li>식별자 추출: X-User-Id → 신뢰 프록시 헤더 → remoteAddr
 *   <li>고정 윈도우 카운터 확인
 *   <li>초과 시 429 + Retry-After 헤더 + ErrorResponse 본문
 * </ol>
 *
 * <p>@Component 대신 {@code FilterConfig}에서 FilterRegistrationBean으로 등록합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class RateLimitingFilter extends OncePerRequestFilter {

  public static final String USER_ID_HEADER = "X-User-Id";
  public static final String REMAINING_HEADER = "X-RateLimit-Remaining";

  static final String ROUTE_REGENERATE = "suggestion-regenerate";
  static final String ROUTE_SUGGESTION = "suggestion";
  static final String ROUTE_DEFAULT = "default";

  private static final Pattern REGENERATE_PATH =
      Pattern.compile("^/api/v1/trips/[^/]+/suggestions/regenerate/?$");

  private final RateLimiter rateLimiter;
  private final RateLimitProperties properties;
  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !properties.enabled() || !request.getRequestURI().startsWith("/api/");
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String route = resolveRoute(request);
    String identity = resolveIdentity(request);

    // 리미터 자체 오류는 Fail-Open
    RateLimitDecision decision =
        executor.executeOrDefault(
            () -> rateLimiter.checkRateLimit(route, identity),
            RateLimitDecision.allowed(Long.MAX_VALUE),
            TaskContext.of("RateLimit", "Filter", LogMasking.maskIdentity(identity)));

    if (!decision.allowed()) {
      handleRateLimitExceeded(response, route, identity, decision);
      return;
    }

    if (decision.remaining() != Long.MAX_VALUE) {
      response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
    }
    filterChain.doFilter(request, response);
  }

  String resolveRoute(HttpServletRequest request) {
    String uri = request.getRequestURI();
    if (REGENERATE_PATH.matcher(uri).matches()) {
      return ROUTE_REGENERATE;
    }
    if (uri.startsWith("/api/v1/suggestions")) {
      return ROUTE_SUGGESTION;
    }
    return ROUTE_DEFAULT;
  }

  /** X-User-Id → trustedHeaders 순서 → remoteAddr. X-Forwarded-For는 첫 번째 IP만 사용 */
  String resolveIdentity(HttpServletRequest request) {
    String userId = request.getHeader(USER_ID_HEADER);
    if (userId != null && !userId.isBlank()) {
      return "user:" + userId.trim();
    }
    for (String header : properties.trustedHeaders()) {
      String headerValue = request.getHeader(header);
      if (headerValue != null && !headerValue.isBlank()) {
        String ip = headerValue.split(",")[0].trim();
        if (!ip.isBlank()) {
          return "ip:" + ip;
        }
      }
    }
    return "ip:" + request.getRemoteAddr();
  }

  private void handleRateLimitExceeded(
      HttpServletResponse response, String route, String identity, RateLimitDecision decision)
      throws IOException {
    RateLimitExceededException exception =
        new RateLimitExceededException(decision.retryAfterSeconds());

    response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding("UTF-8");
    response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
    response.setHeader(REMAINING_HEADER, "0");
    objectMapper.writeValue(response.getWriter(), ErrorResponse.from(exception));

    log.warn(
        "[RateLimit] Rejected route={} identity={} retryAfter={}s",
        route,
        LogMasking.maskIdentity(identity),
        decision.retryAfterSeconds());
  }
}

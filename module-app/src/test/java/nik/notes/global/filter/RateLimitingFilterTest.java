package nik.notes.global.filter;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import nik.notes.infrastructure.config.RateLimitProperties;
import nik.notes.infrastructure.config.RateLimitProperties.Rule;
import nik.notes.infrastructure.ratelimit.FixedWindowRateLimiter;
import nik.notes.support.MutableClock;
import nik.notes.support.RecordingCacheBackend;
import nik.notes.support.SuggestionFixtures;
import nik.notes.support.TestLogicExecutors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@Tag("unit")
@DisplayName("RateLimitingFilter")
class RateLimitingFilterTest {

  private static final String REGENERATE_URI = "/api/v1/trips/7/suggestions/regenerate";

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

  private MutableClock clock;
  private RateLimitingFilter filter;

  @BeforeEach
  void setUp() {
    // 윈도우 중간에서 시작 (정렬된 윈도우 시작 + 10분)
    clock = new MutableClock(Instant.parse("2026-07-01T10:10:00Z"));
    RecordingCacheBackend backend = new RecordingCacheBackend();
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    RateLimitProperties properties =
        new RateLimitProperties(
            true,
            "{ratelimit}",
            new Rule(5, Duration.ofHours(1)),
            Map.of("suggestion-regenerate", new Rule(2, Duration.ofHours(1))),
            List.of("X-Forwarded-For"),
            1_000);
    FixedWindowRateLimiter rateLimiter =
        new FixedWindowRateLimiter(
            SuggestionFixtures.cacheAdapter(backend, clock, meterRegistry),
            properties,
            clock,
            meterRegistry);
    filter =
        new RateLimitingFilter(
            rateLimiter, properties, objectMapper, TestLogicExecutors.passThrough());
  }

  private MockHttpServletResponse send(MockHttpServletRequest request) throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();
    filter.doFilter(request, response, new MockFilterChain());
    return response;
  }

  private MockHttpServletRequest regenerate(String userId) {
    MockHttpServletRequest request = new MockHttpServletRequest("POST", REGENERATE_URI);
    request.addHeader(RateLimitingFilter.USER_ID_HEADER, userId);
    return request;
  }

  @Nested
  @DisplayName("한도 초과")
  class Exceeded {

    @Test
    @DisplayName("(L+1)번째 요청은 429 + Retry-After + ErrorResponse 본문")
    void rejectsWithRetryAfter() throws Exception {
      assertThat(send(regenerate("alice")).getStatus()).isEqualTo(200);
      assertThat(send(regenerate("alice")).getStatus()).isEqualTo(200);

      MockHttpServletResponse rejected = send(regenerate("alice"));

      assertThat(rejected.getStatus()).isEqualTo(429);
      assertThat(rejected.getHeader(HttpHeaders.RETRY_AFTER)).isEqualTo("3000");
      JsonNode body = objectMapper.readTree(rejected.getContentAsString());
      assertThat(body.get("code").asText()).isEqualTo("C003");
      assertThat(body.get("status").asInt()).isEqualTo(429);
    }

    @Test
    @DisplayName("윈도우가 지나면 다시 허용")
    void allowsAgainAfterWindow() throws Exception {
      send(regenerate("alice"));
      send(regenerate("alice"));
      assertThat(send(regenerate("alice")).getStatus()).isEqualTo(429);

      clock.advance(Duration.ofHours(1));

      assertThat(send(regenerate("alice")).getStatus()).isEqualTo(200);
    }

    @Test
    @DisplayName("허용된 요청은 남은 횟수 헤더를 포함")
    void exposesRemaining() throws Exception {
      MockHttpServletResponse response = send(regenerate("alice"));

      assertThat(response.getHeader(RateLimitingFilter.REMAINING_HEADER)).isEqualTo("1");
    }
  }

  @Nested
  @DisplayName("식별자와 route")
  class IdentityAndRoute {

    @Test
    @DisplayName("사용자별로 독립된 카운터")
    void countsPerUser() throws Exception {
      send(regenerate("alice"));
      send(regenerate("alice"));

      assertThat(send(regenerate("bob")).getStatus()).isEqualTo(200);
    }

    @Test
    @DisplayName("X-User-Id가 없으면 신뢰 프록시 헤더의 첫 IP 사용")
    void usesForwardedFor() {
      MockHttpServletRequest request = new MockHttpServletRequest("POST", REGENERATE_URI);
      request.addHeader("X-Forwarded-For", "203.0.113.9, 10.0.0.1");

      assertThat(filter.resolveIdentity(request)).isEqualTo("ip:203.0.113.9");
    }

    @Test
    @DisplayName("헤더가 전혀 없으면 remoteAddr 사용")
    void fallsBackToRemoteAddr() {
      MockHttpServletRequest request = new MockHttpServletRequest("POST", REGENERATE_URI);
      request.setRemoteAddr("198.51.100.4");

      assertThat(filter.resolveIdentity(request)).isEqualTo("ip:198.51.100.4");
    }

    @Test
    @DisplayName("재생성은 별도 route, 일반 제안 조회는 suggestion route")
    void mapsRoutes() {
      assertThat(filter.resolveRoute(new MockHttpServletRequest("POST", REGENERATE_URI)))
          .isEqualTo("suggestion-regenerate");
      assertThat(filter.resolveRoute(new MockHttpServletRequest("POST", "/api/v1/suggestions")))
          .isEqualTo("suggestion");
      assertThat(filter.resolveRoute(new MockHttpServletRequest("DELETE", "/api/v1/trips/7")))
          .isEqualTo("default");
    }

    @Test
    @DisplayName("/api 밖의 경로는 검사하지 않는다")
    void skipsNonApiPaths() throws Exception {
      for (int i = 0; i < 10; i++) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");
        assertThat(send(request).getStatus()).isEqualTo(200);
      }
    }
  }
}

package nik.notes.infrastructure.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Rate Limiting 설정
 *
 * <pre>{@code
 * ratelimit:
 *   enabled: true
 *   key-prefix: "{ratelimit}"
 *   default-rule:
 *     limit: 50
 *     window: 1h
 *   rules:
 *     suggestion-regenerate:
 *       limit: 10
 *       window: 1h
 *   trusted-headers: X-Forwarded-For, X-Real-IP
 *   local-max-entries: 100000
 * }</pre>
 */
@ConfigurationProperties(prefix = "ratelimit")
public record RateLimitProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("{ratelimit}") String keyPrefix,
    @DefaultValue Rule defaultRule,
    Map<String, Rule> rules,
    @DefaultValue({"X-Forwarded-For", "X-Real-IP"}) List<String> trustedHeaders,
    @DefaultValue("100000") long localMaxEntries) {

  public RateLimitProperties {
    rules = rules == null ? Map.of() : Map.copyOf(rules);
    trustedHeaders = trustedHeaders == null ? List.of() : List.copyOf(trustedHeaders);
    if (localMaxEntries <= 0) {
      throw new IllegalArgumentException("ratelimit.local-max-entries must be positive");
    }
  }

  public Rule ruleFor(String route) {
    return rules.getOrDefault(route, defaultRule);
  }

  /**
   * 고정 윈도우 규칙
   *
   * @param limit 윈도우당 허용 호출 수 (L)
   * @param window 윈도우 길이 (W)
   */
  public record Rule(@DefaultValue("50") long limit, @DefaultValue("1h") Duration window) {

    public Rule {
      if (limit <= 0) {
        throw new IllegalArgumentException("rate limit must be positive, got: " + limit);
      }
      CacheStoreProperties.requirePositive(window, "rate limit window");
    }
  }
}

package nik.notes.infrastructure.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import nik.notes.core.domain.model.RateLimitDecision;
import nik.notes.core.domain.model.RateWindow;
import nik.notes.infrastructure.cache.CacheStoreAdapter;
import nik.notes.infrastructure.config.RateLimitProperties;
import nik.notes.infrastructure.config.RateLimitProperties.Rule;
import nik.notes.infrastructure.util.LogMasking;

/**
 * 고정 윈도우 Rate Limiter (공유 캐시 우선, 프로세스 로컬 폴백)
 *
 * <h3>윈도우</h3>
 *
 * <p>윈도우 시작은 epoch 기준으로 정렬되며 키에 포함됩니다: {@code {ratelimit}:<route>:<identity>:<windowStartMillis>}.
 * 윈도우가 바뀌면 새 키가 되므로 리셋 연산이 필요 없습니다.
 *
 * <h3>저장소</h3>
 *
 * <ul>
 *   <li>캐시 정상: Lua 스크립트로 INCR + 최초 PEXPIRE (인스턴스 간 공유 카운트)
 *   <li>캐시 장애/단락: Caffeine 로컬 카운터. 인스턴스별로 따로 세므로 클러스터 전체 한도는 느슨해진다
 * </ul>
 */
@Slf4j
public class FixedWindowRateLimiter implements RateLimiter {

  private static final String STORE_SHARED = "shared";
  private static final String STORE_LOCAL = "local";

  private final CacheStoreAdapter cache;
  private final RateLimitProperties properties;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final Cache<String, AtomicLong> localCounters;

  public FixedWindowRateLimiter(
      CacheStoreAdapter cache,
      RateLimitProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.cache = cache;
    this.properties = properties;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    this.localCounters =
        Caffeine.newBuilder()
            .maximumSize(properties.localMaxEntries())
            .expireAfterWrite(longestWindow(properties))
            .build();
  }

  @Override
  public RateLimitDecision checkRateLimit(String route, String identity) {
    if (!properties.enabled()) {
      return RateLimitDecision.allowed(Long.MAX_VALUE);
    }
    Rule rule = properties.ruleFor(route);
    Instant now = clock.instant();
    RateWindow window = RateWindow.of(0, now, rule.window());
    String key = buildKey(route, identity, window.windowStart());

    OptionalLong shared =
        cache.health() ? cache.incrementWindow(key, rule.window()) : OptionalLong.empty();
    long count;
    String store;
    if (shared.isPresent()) {
      count = shared.getAsLong();
      store = STORE_SHARED;
    } else {
      count = localCounters.get(key, k -> new AtomicLong()).incrementAndGet();
      store = STORE_LOCAL;
    }

    RateLimitDecision decision =
        count <= rule.limit()
            ? RateLimitDecision.allowed(rule.limit() - count)
            : RateLimitDecision.rejected(
                new RateWindow(count, window.windowStart(), rule.window()).retryAfterSeconds(now));
    recordMetrics(route, decision, store);

    if (!decision.allowed()) {
      log.info(
          "[RateLimit] Rejected route={}, identity={}, count={}/{}, retryAfter={}s, store={}",
          route,
          LogMasking.maskIdentity(identity),
          count,
          rule.limit(),
          decision.retryAfterSeconds(),
          store);
    }
    return decision;
  }

  private String buildKey(String route, String identity, Instant windowStart) {
    return properties.keyPrefix() + ":" + route + ":" + identity + ":" + windowStart.toEpochMilli();
  }

  private void recordMetrics(String route, RateLimitDecision decision, String store) {
    meterRegistry
        .counter(
            "ratelimit.check",
            "route", route,
            "result", decision.allowed() ? "allowed" : "rejected",
            "store", store)
        .increment();
  }

  private static Duration longestWindow(RateLimitProperties properties) {
    return Stream.concat(Stream.of(properties.defaultRule()), properties.rules().values().stream())
        .map(Rule::window)
        .max(Duration::compareTo)
        .orElse(Duration.ofHours(1));
  }
}

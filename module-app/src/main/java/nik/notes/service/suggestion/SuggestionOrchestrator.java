package nik.notes.service.suggestion;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import nik.notes.config.SuggestionProperties;
import nik.notes.core.degradation.DegradationAction;
import nik.notes.core.degradation.DegradationPolicy;
import nik.notes.core.degradation.DependencyRole;
import nik.notes.core.domain.model.Fingerprint;
import nik.notes.core.domain.model.RequestParameters;
import nik.notes.core.domain.model.SuggestionList;
import nik.notes.core.domain.model.WeatherSnapshot;
import nik.notes.core.fingerprint.FingerprintDeriver;
import nik.notes.core.port.out.MockBackend;
import nik.notes.core.suggestion.RequestParametersValidator;
import nik.notes.infrastructure.cache.CacheStoreAdapter;
import nik.notes.infrastructure.concurrency.SingleFlightCoordinator;
import nik.notes.infrastructure.executor.LogicExecutor;
import nik.notes.infrastructure.executor.TaskContext;
import nik.notes.infrastructure.generation.GenerationBackendAdapter;
import nik.notes.infrastructure.util.LogMasking;
import nik.notes.infrastructure.weather.WeatherContextAdapter;
import org.springframework.stereotype.Service;

/**
 * 제안 조회 오케스트레이터
 *
 * <h3>흐름</h3>
 *
 * <ol>
 *   <li>파라미터 검증 (실패 시 즉시 400, 캐시/생성 미접근)
 *   <li>날씨 보강 (보조 의존성, 불가 시 생략)
 *   <li>fingerprint 계산 → 캐시 조회 (캐시 불가 시 우회)
 *   <li>미스 → single-flight 슬롯에서 생성 → 캐시 저장
 *   <li>생성 실패/타임아웃/Unavailable → mock 생성기
 * </ol>
 *
 * <p>호출자에게 노출되는 실패는 검증 오류뿐입니다. 의존성 장애는 모두 여기서 흡수됩니다.
 */
@Slf4j
@Service
public class SuggestionOrchestrator {

  private static final String COMPONENT = "Suggestion";

  private final CacheStoreAdapter cache;
  private final SingleFlightCoordinator<SuggestionList> singleFlight;
  private final GenerationBackendAdapter generationBackend;
  private final MockBackend mockBackend;
  private final WeatherContextAdapter weather;
  private final SuggestionPayloadCodec codec;
  private final SuggestionProperties properties;
  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;
  private final Counter hitCounter;
  private final Counter missCounter;

  public SuggestionOrchestrator(
      CacheStoreAdapter cache,
      SingleFlightCoordinator<SuggestionList> singleFlight,
      GenerationBackendAdapter generationBackend,
      MockBackend mockBackend,
      WeatherContextAdapter weather,
      SuggestionPayloadCodec codec,
      SuggestionProperties properties,
      LogicExecutor executor,
      MeterRegistry meterRegistry) {
    this.cache = cache;
    this.singleFlight = singleFlight;
    this.generationBackend = generationBackend;
    this.mockBackend = mockBackend;
    this.weather = weather;
    this.codec = codec;
    this.properties = properties;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
    this.hitCounter = cacheCounter("hit");
    this.missCounter = cacheCounter("miss");
  }

  public SuggestionList getSuggestions(RequestParameters params) {
    return resolve(params).suggestions();
  }

  /**
   * {@link #getSuggestions}와 같지만 결과가 저장된 fingerprint도 함께 반환합니다.
   *
   * @throws nik.notes.error.exception.InvalidRequestParametersException 파라미터 검증 실패
   */
  public SuggestionOutcome resolve(RequestParameters params) {
    RequestParameters validated = RequestParametersValidator.validate(params);
    RequestParameters enriched = enrich(validated);
    Fingerprint fingerprint = FingerprintDeriver.derive(enriched);

    boolean cacheUsable = cacheUsable();
    if (cacheUsable) {
      Optional<SuggestionList> cached = readCached(fingerprint);
      if (cached.isPresent()) {
        hitCounter.increment();
        log.debug("[Suggestion] Cache hit for {}", LogMasking.maskKey(fingerprint.value()));
        return new SuggestionOutcome(fingerprint, cached.get());
      }
    }
    missCounter.increment();

    SuggestionList suggestions =
        singleFlight.execute(
            fingerprint.value(),
            () -> generateAndStore(fingerprint, enriched),
            () -> cacheUsable ? readCached(fingerprint) : Optional.empty(),
            () -> fallback(enriched, "slot-timeout"));
    return new SuggestionOutcome(fingerprint, suggestions);
  }

  public CacheStats cacheStats() {
    return CacheStats.of(
        (long) hitCounter.count(),
        (long) missCounter.count(),
        cache.capability().status(),
        generationBackend.capability().status());
  }

  private RequestParameters enrich(RequestParameters params) {
    if (params.hasWeather()) {
      return params;
    }
    DegradationAction action =
        DegradationPolicy.decide(DependencyRole.AUXILIARY_CONTEXT, weather.capability());
    if (action == DegradationAction.OMIT_CONTEXT) {
      return params;
    }
    Optional<WeatherSnapshot> snapshot = weather.lookup(params.destination(), params.startDate());
    return snapshot.map(params::withWeather).orElse(params);
  }

  private SuggestionList generateAndStore(Fingerprint fingerprint, RequestParameters params) {
    SuggestionList suggestions = generate(fingerprint, params);
    if (suggestions.isMock() && !properties.cacheMockResults()) {
      return suggestions;
    }
    if (cacheUsable()) {
      Duration ttl = suggestions.isMock() ? properties.mockTtl() : properties.ttl();
      cache.set(fingerprint.value(), codec.encode(suggestions), ttl);
    }
    return suggestions;
  }

  private SuggestionList generate(Fingerprint fingerprint, RequestParameters params) {
    DegradationAction action =
        DegradationPolicy.decide(
            DependencyRole.GENERATION_BACKEND, generationBackend.capability());
    if (action == DegradationAction.USE_MOCK_GENERATOR) {
      return fallback(params, "backend-unavailable");
    }
    return executor.executeOrCatch(
        () -> {
          SuggestionList generated =
              generationBackend.generate(params, properties.generationTimeout());
          generationCounter("generated").increment();
          return generated;
        },
        e -> {
          log.warn(
              "[Suggestion] Generation failed for {}, using mock generator: {}",
              LogMasking.maskKey(fingerprint.value()),
              e.getMessage());
          return fallback(params, "backend-failure");
        },
        TaskContext.of(COMPONENT, "generate", fingerprint.digest()));
  }

  private SuggestionList fallback(RequestParameters params, String reason) {
    generationCounter(reason).increment();
    return mockBackend.generate(params);
  }

  private Optional<SuggestionList> readCached(Fingerprint fingerprint) {
    return cache.get(fingerprint.value()).flatMap(codec::decode);
  }

  private boolean cacheUsable() {
    return DegradationPolicy.decide(DependencyRole.CACHE, cache.health())
        == DegradationAction.PROCEED;
  }

  private Counter cacheCounter(String result) {
    return Counter.builder("suggestion.cache").tag("result", result).register(meterRegistry);
  }

  private Counter generationCounter(String outcome) {
    return Counter.builder("suggestion.generation").tag("outcome", outcome).register(meterRegistry);
  }
}

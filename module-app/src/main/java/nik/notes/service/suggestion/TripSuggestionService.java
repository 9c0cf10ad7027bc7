package nik.notes.service.suggestion;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import nik.notes.config.SuggestionProperties;
import nik.notes.core.degradation.DegradationAction;
import nik.notes.core.degradation.DegradationPolicy;
import nik.notes.core.degradation.DependencyRole;
import nik.notes.core.domain.model.SuggestionList;
import nik.notes.core.domain.model.TripRecord;
import nik.notes.core.port.out.TripStore;
import nik.notes.error.exception.TripNotFoundException;
import nik.notes.infrastructure.cache.CacheStoreAdapter;
import org.springframework.stereotype.Service;

/**
 * 저장된 여행 기준 제안 재생성 / 캐시 무효화
 *
 * <p>관계형 저장소는 필수 의존성이므로 {@link nik.notes.error.exception.StoreFailureException}은 그대로 전파합니다. 캐시
 * 매핑 기록/삭제는 캐시 health가 false이면 백엔드를 건드리지 않고 생략됩니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TripSuggestionService {

  private final TripStore tripStore;
  private final SuggestionOrchestrator orchestrator;
  private final CacheStoreAdapter cache;
  private final SuggestionProperties properties;

  /**
   * @throws TripNotFoundException 존재하지 않는 여행
   * @throws nik.notes.error.exception.StoreFailureException 저장소 장애
   */
  public SuggestionList regenerate(long tripId) {
    TripRecord trip =
        tripStore.findById(tripId).orElseThrow(() -> new TripNotFoundException(tripId));
    SuggestionOutcome outcome = orchestrator.resolve(trip.toRequestParameters());

    if (!cacheUsable()) {
      log.debug("[Suggestion] Cache unavailable, trip mapping skipped for trip {}", tripId);
      return outcome.suggestions();
    }
    byte[] fingerprint = outcome.fingerprint().value().getBytes(StandardCharsets.UTF_8);
    if (!cache.set(mappingKey(tripId), fingerprint, properties.ttl())) {
      log.debug("[Suggestion] Trip mapping not recorded for trip {}", tripId);
    }
    return outcome.suggestions();
  }

  /** @return 무효화된 항목이 있으면 true */
  public boolean invalidate(long tripId) {
    if (!cacheUsable()) {
      log.debug("[Suggestion] Cache unavailable, nothing invalidated for trip {}", tripId);
      return false;
    }
    String mappingKey = mappingKey(tripId);
    Optional<String> fingerprint =
        cache.get(mappingKey).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    if (fingerprint.isEmpty()) {
      return false;
    }
    boolean suggestionsDeleted = cache.delete(fingerprint.get());
    boolean mappingDeleted = cache.delete(mappingKey);
    log.info(
        "[Suggestion] Invalidated trip {} (suggestions={}, mapping={})",
        tripId,
        suggestionsDeleted,
        mappingDeleted);
    return suggestionsDeleted || mappingDeleted;
  }

  private boolean cacheUsable() {
    return DegradationPolicy.decide(DependencyRole.CACHE, cache.health())
        == DegradationAction.PROCEED;
  }

  private String mappingKey(long tripId) {
    return properties.tripMappingPrefix() + tripId;
  }
}

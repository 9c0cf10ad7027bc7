package nik.notes.service.suggestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import nik.notes.core.domain.model.Fingerprint;
import nik.notes.core.domain.model.RequestParameters;
import nik.notes.core.domain.model.SuggestionList;
import nik.notes.core.domain.model.TransportMethod;
import nik.notes.core.domain.model.TravelStyle;
import nik.notes.core.domain.model.TravelerComposition;
import nik.notes.core.domain.model.TravelerType;
import nik.notes.core.domain.model.TripRecord;
import nik.notes.core.port.out.TripStore;
import nik.notes.error.exception.StoreFailureException;
import nik.notes.error.exception.TripNotFoundException;
import nik.notes.infrastructure.cache.CacheStoreAdapter;
import nik.notes.support.MutableClock;
import nik.notes.support.RecordingCacheBackend;
import nik.notes.support.SuggestionFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("TripSuggestionService")
class TripSuggestionServiceTest {

  private static final long TRIP_ID = 42L;
  private static final Fingerprint FINGERPRINT =
      Fingerprint.ofDigest("0123456789abcdef0123456789abcdef");
  private static final SuggestionList SUGGESTIONS =
      SuggestionList.generated(List.of("2 x Sunscreen", "1 x Hat"));

  private static final TripRecord TRIP =
      new TripRecord(
          TRIP_ID,
          "Lisbon",
          LocalDate.of(2026, 8, 10),
          LocalDate.of(2026, 8, 13),
          TravelStyle.LEISURE,
          TransportMethod.FLIGHT,
          TravelerComposition.of(Map.of(TravelerType.ADULT, 2)),
          List.of("beach"));

  private final TripStore tripStore = mock(TripStore.class);
  private final SuggestionOrchestrator orchestrator = mock(SuggestionOrchestrator.class);

  private RecordingCacheBackend backend;
  private TripSuggestionService service;

  @BeforeEach
  void setUp() {
    backend = new RecordingCacheBackend();
    CacheStoreAdapter cache =
        SuggestionFixtures.cacheAdapter(
            backend,
            new MutableClock(Instant.parse("2026-08-01T00:00:00Z")),
            new SimpleMeterRegistry());
    service =
        new TripSuggestionService(
            tripStore, orchestrator, cache, SuggestionFixtures.suggestionProperties(false));
  }

  private void givenStoredTrip() {
    given(tripStore.findById(TRIP_ID)).willReturn(Optional.of(TRIP));
    given(orchestrator.resolve(any(RequestParameters.class)))
        .willReturn(new SuggestionOutcome(FINGERPRINT, SUGGESTIONS));
  }

  @Nested
  @DisplayName("regenerate")
  class Regenerate {

    @Test
    @DisplayName("여행 정보를 파라미터로 변환해 제안을 받고 여행→fingerprint 매핑을 같은 TTL로 기록")
    void recordsTripMapping() {
      givenStoredTrip();

      SuggestionList result = service.regenerate(TRIP_ID);

      assertThat(result).isEqualTo(SUGGESTIONS);
      verify(orchestrator).resolve(TRIP.toRequestParameters());
      assertThat(backend.contains("ai_trip_mapping:42")).isTrue();
      assertThat(backend.ttlSeconds("ai_trip_mapping:42")).isEqualTo(86_400L);
    }

    @Test
    @DisplayName("존재하지 않는 여행은 TripNotFoundException")
    void unknownTrip() {
      given(tripStore.findById(TRIP_ID)).willReturn(Optional.empty());

      assertThatThrownBy(() -> service.regenerate(TRIP_ID))
          .isInstanceOf(TripNotFoundException.class);
      verify(orchestrator, never()).resolve(any());
    }

    @Test
    @DisplayName("저장소 장애(StoreFailure)는 삼키지 않고 전파")
    void storeFailureSurfaces() {
      given(tripStore.findById(TRIP_ID))
          .willThrow(new StoreFailureException("trip lookup", new RuntimeException("down")));

      assertThatThrownBy(() -> service.regenerate(TRIP_ID))
          .isInstanceOf(StoreFailureException.class);
      verify(orchestrator, never()).resolve(any());
    }

    @Test
    @DisplayName("캐시 장애 시 매핑 기록은 조용히 생략")
    void mappingSkippedWhenCacheDown() {
      givenStoredTrip();
      backend.failing(true);

      assertThat(service.regenerate(TRIP_ID)).isEqualTo(SUGGESTIONS);
    }

    @Test
    @DisplayName("ping이 실패하면 매핑 쓰기를 시도조차 하지 않는다")
    void noMappingWriteWhenPingFails() {
      givenStoredTrip();
      backend.pingHealthy(false);

      assertThat(service.regenerate(TRIP_ID)).isEqualTo(SUGGESTIONS);
      assertThat(backend.writeCalls()).isZero();
      assertThat(backend.contains("ai_trip_mapping:42")).isFalse();
    }
  }

  @Nested
  @DisplayName("invalidate")
  class Invalidate {

    @Test
    @DisplayName("매핑된 제안 캐시와 매핑을 모두 삭제")
    void deletesSuggestionsAndMapping() {
      givenStoredTrip();
      service.regenerate(TRIP_ID);
      backend.set(FINGERPRINT.value(), "payload".getBytes(StandardCharsets.UTF_8), 60);

      boolean invalidated = service.invalidate(TRIP_ID);

      assertThat(invalidated).isTrue();
      assertThat(backend.contains(FINGERPRINT.value())).isFalse();
      assertThat(backend.contains("ai_trip_mapping:42")).isFalse();
    }

    @Test
    @DisplayName("매핑이 없으면 false")
    void nothingToInvalidate() {
      assertThat(service.invalidate(TRIP_ID)).isFalse();
    }

    @Test
    @DisplayName("캐시 장애 시 예외 없이 false")
    void cacheDown() {
      backend.failing(true);

      assertThat(service.invalidate(TRIP_ID)).isFalse();
    }

    @Test
    @DisplayName("ping이 실패하면 매핑을 읽지 않고 false")
    void noMappingReadWhenPingFails() {
      givenStoredTrip();
      service.regenerate(TRIP_ID);
      backend.pingHealthy(false);
      int readsBefore = backend.getCalls();

      assertThat(service.invalidate(TRIP_ID)).isFalse();
      assertThat(backend.getCalls()).isEqualTo(readsBefore);
      assertThat(backend.contains("ai_trip_mapping:42")).isTrue();
    }
  }
}

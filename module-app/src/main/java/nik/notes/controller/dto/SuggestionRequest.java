package nik.notes.controller.dto;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import nik.notes.core.domain.model.RequestParameters;
import nik.notes.core.domain.model.TransportMethod;
import nik.notes.core.domain.model.TravelStyle;
import nik.notes.core.domain.model.TravelerComposition;
import nik.notes.core.domain.model.TravelerType;

/**
 * 제안 요청 본문
 *
 * <pre>{@code
 * {
 *   "destination": "Paris",
 *   "duration": 5,
 *   "travelStyle": "leisure",
 *   "transportMethod": "flight",
 *   "travelers": {"adult": 2, "child": 1},
 *   "startDate": "2026-07-01",
 *   "activities": ["museums"]
 * }
 * }</pre>
 *
 * <p>값 검증은 {@link nik.notes.core.suggestion.RequestParametersValidator}가 담당하며, 여기서는 enum 값 해석만 합니다.
 */
public record SuggestionRequest(
    String destination,
    Integer duration,
    String travelStyle,
    String transportMethod,
    Map<String, Integer> travelers,
    LocalDate startDate,
    List<String> activities) {

  public RequestParameters toParameters() {
    return RequestParameters.builder()
        .destination(destination)
        .durationDays(duration == null ? 0 : duration)
        .travelStyle(TravelStyle.fromValue(travelStyle))
        .transportMethod(TransportMethod.fromValue(transportMethod))
        .travelers(toComposition())
        .startDate(startDate)
        .activities(activities)
        .build();
  }

  private TravelerComposition toComposition() {
    if (travelers == null) {
      return null;
    }
    Map<TravelerType, Integer> counts = new EnumMap<>(TravelerType.class);
    travelers.forEach(
        (type, count) -> {
          if (count != null) {
            counts.merge(TravelerType.fromValue(type), count, Integer::sum);
          }
        });
    return TravelerComposition.of(counts);
  }
}

package nik.notes.core.domain.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import lombok.Builder;

/**
 * Inputs that determine a suggestion set.
 *
 * <p>Immutable. Enrichment (e.g. attaching a weather snapshot) returns a new instance. Omitted
 * style, transport and travelers fall back to {@link TravelStyle#LEISURE}, {@link
 * TransportMethod#FLIGHT} and one adult. The destination is kept as given; canonical forms are the
 * fingerprint's concern.
 *
 * @param destination free-text destination
 * @param durationDays trip length in days
 * @param travelStyle travel style
 * @param transportMethod transport method
 * @param travelers traveler composition
 * @param startDate first day of the trip, may be {@code null}
 * @param activities planned activities, never {@code null}
 * @param weather weather snapshot, may be {@code null}
 */
@Builder(toBuilder = true)
public record RequestParameters(
    String destination,
    int durationDays,
    TravelStyle travelStyle,
    TransportMethod transportMethod,
    TravelerComposition travelers,
    LocalDate startDate,
    List<String> activities,
    WeatherSnapshot weather) {

  public RequestParameters {
    travelStyle = Objects.requireNonNullElse(travelStyle, TravelStyle.LEISURE);
    transportMethod = Objects.requireNonNullElse(transportMethod, TransportMethod.FLIGHT);
    travelers = travelers == null ? TravelerComposition.oneAdult() : travelers;
    activities =
        activities == null
            ? List.of()
            : activities.stream().filter(Objects::nonNull).toList();
  }

  public RequestParameters withWeather(WeatherSnapshot snapshot) {
    return toBuilder().weather(snapshot).build();
  }

  public boolean hasWeather() {
    return weather != null;
  }
}

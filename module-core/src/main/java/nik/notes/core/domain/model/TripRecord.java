package nik.notes.core.domain.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * A stored trip, as read from the durable store.
 *
 * <p>Only the fields that influence suggestions are carried.
 */
public record TripRecord(
    long id,
    String destination,
    LocalDate startDate,
    LocalDate endDate,
    TravelStyle travelStyle,
    TransportMethod transportMethod,
    TravelerComposition travelers,
    List<String> activities) {

  public TripRecord {
    activities = activities == null ? List.of() : List.copyOf(activities);
  }

  /** Inclusive day count; a trip without an end date lasts one day. */
  public int durationDays() {
    if (startDate == null || endDate == null) {
      return 1;
    }
    return (int) Math.max(1, ChronoUnit.DAYS.between(startDate, endDate) + 1);
  }

  public RequestParameters toRequestParameters() {
    return RequestParameters.builder()
        .destination(destination)
        .durationDays(durationDays())
        .travelStyle(travelStyle)
        .transportMethod(transportMethod)
        .travelers(travelers)
        .startDate(startDate)
        .activities(activities)
        .build();
  }
}

package nik.notes.core.domain.model;

import java.util.Arrays;
import java.util.Locale;
import nik.notes.error.exception.InvalidRequestParametersException;

/** How the travelers get to the destination. Wire value is the lower-case name ({@code "road_trip"}). */
public enum TransportMethod {
  FLIGHT,
  ROAD_TRIP,
  TRAIN,
  CRUISE,
  OTHER;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static TransportMethod fromValue(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    return Arrays.stream(values())
        .filter(method -> method.name().equals(normalized))
        .findFirst()
        .orElseThrow(
            () ->
                new InvalidRequestParametersException("unknown transport method '" + value + "'"));
  }
}

package nik.notes.core.domain.model;

import java.util.Arrays;
import java.util.Locale;
import nik.notes.error.exception.InvalidRequestParametersException;

/** Travel style of a trip. Wire value is the lower-case name ({@code "leisure"}). */
public enum TravelStyle {
  BUSINESS,
  LEISURE,
  ADVENTURE,
  BACKPACKING,
  LUXURY;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a wire value, case-insensitive.
   *
   * @param value wire value, {@code null} or blank means "not given"
   * @return the style, or {@code null} when not given
   * @throws InvalidRequestParametersException unknown value
   */
  public static TravelStyle fromValue(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(style -> style.name().equals(normalized))
        .findFirst()
        .orElseThrow(
            () -> new InvalidRequestParametersException("unknown travel style '" + value + "'"));
  }
}

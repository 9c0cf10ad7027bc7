package nik.notes.core.domain.model;

import java.util.Arrays;
import java.util.Locale;
import nik.notes.error.exception.InvalidRequestParametersException;

public enum TravelerType {
  ADULT,
  CHILD,
  INFANT,
  PET;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static TravelerType fromValue(String value) {
    String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(type -> type.name().equals(normalized))
        .findFirst()
        .orElseThrow(
            () -> new InvalidRequestParametersException("unknown traveler type '" + value + "'"));
  }
}

package nik.notes.core.domain.model;

/**
 * Expected weather at the destination for the trip dates.
 *
 * @param condition free-text condition ("light rain", "Clear")
 * @param minTempCelsius lowest expected temperature
 * @param maxTempCelsius highest expected temperature
 * @param humidityPercent average relative humidity, 0..100
 * @param rainExpected precipitation as rain in the forecast
 * @param snowExpected precipitation as snow in the forecast
 */
public record WeatherSnapshot(
    String condition,
    double minTempCelsius,
    double maxTempCelsius,
    int humidityPercent,
    boolean rainExpected,
    boolean snowExpected) {

  public WeatherSnapshot {
    condition = condition == null ? "" : condition;
  }

  /** Human readable one-liner used in generation prompts, e.g. {@code "Clear, 12-18°C, 60% humidity"}. */
  public String summary() {
    StringBuilder sb = new StringBuilder();
    if (!condition.isBlank()) {
      sb.append(Character.toUpperCase(condition.charAt(0))).append(condition.substring(1));
      sb.append(", ");
    }
    sb.append(Math.round(minTempCelsius)).append('-').append(Math.round(maxTempCelsius));
    sb.append("°C, ").append(humidityPercent).append("% humidity");
    if (rainExpected) {
      sb.append(", rain expected");
    }
    if (snowExpected) {
      sb.append(", snow expected");
    }
    return sb.toString();
  }
}

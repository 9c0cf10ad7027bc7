package nik.notes.infrastructure.weather.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** OpenWeatherMap /data/2.5/weather 응답 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OpenWeatherCurrentResponse(Main main, List<Condition> weather) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Main(
      double temp,
      @JsonProperty("feels_like") double feelsLike,
      @JsonProperty("temp_min") double tempMin,
      @JsonProperty("temp_max") double tempMax,
      int humidity) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Condition(String main, String description) {}
}

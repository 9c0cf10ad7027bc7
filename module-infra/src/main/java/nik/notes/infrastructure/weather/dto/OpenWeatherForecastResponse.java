package nik.notes.infrastructure.weather.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import nik.notes.infrastructure.weather.dto.OpenWeatherCurrentResponse.Condition;
import nik.notes.infrastructure.weather.dto.OpenWeatherCurrentResponse.Main;

/** OpenWeatherMap /data/2.5/forecast 응답 (3시간 단위 5일 예보) */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OpenWeatherForecastResponse(List<Entry> list) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Entry(Main main, List<Condition> weather) {}
}

package nik.notes.infrastructure.weather;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import nik.notes.core.domain.model.WeatherSnapshot;
import nik.notes.error.exception.DependencyUnavailableException;
import nik.notes.infrastructure.config.WeatherProperties;
import nik.notes.infrastructure.executor.DefaultLogicExecutor;
import nik.notes.infrastructure.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Tag("unit")
@DisplayName("OpenWeatherBackend")
class OpenWeatherBackendTest {

  private static final String FORECAST_JSON =
      """
      {"list":[
        {"main":{"temp":11.4,"feels_like":10,"temp_min":11,"temp_max":12,"humidity":70},
         "weather":[{"main":"Clouds","description":"broken clouds"}]},
        {"main":{"temp":17.6,"feels_like":17,"temp_min":17,"temp_max":18,"humidity":60},
         "weather":[{"main":"Rain","description":"light rain"}]},
        {"main":{"temp":14.0,"feels_like":13,"temp_min":14,"temp_max":14,"humidity":80},
         "weather":[{"main":"Clouds","description":"overcast clouds"}]}
      ]}
      """;

  private static final String CURRENT_JSON =
      """
      {"main":{"temp":25.0,"feels_like":26,"temp_min":22.5,"temp_max":27.5,"humidity":40},
       "weather":[{"main":"Clear","description":"clear sky"}]}
      """;

  private final MutableClock clock = new MutableClock(Instant.parse("2026-05-28T09:00:00Z"));
  private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

  private OpenWeatherBackend backend(HttpStatus status, String body) {
    ExchangeFunction exchange =
        request -> {
          lastRequest.set(request);
          return Mono.just(
              ClientResponse.create(status)
                  .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                  .body(body)
                  .build());
        };
    WeatherProperties properties =
        new WeatherProperties(
            "key",
            "https://api.openweathermap.org",
            "metric",
            Duration.ofSeconds(5),
            Duration.ofSeconds(2),
            Duration.ofHours(24),
            3,
            Duration.ofMinutes(1));
    WebClient webClient =
        WebClient.builder().baseUrl(properties.baseUrl()).exchangeFunction(exchange).build();
    return new OpenWeatherBackend(webClient, properties, new DefaultLogicExecutor(), clock);
  }

  @Test
  @DisplayName("5일 이내 여행은 예보를 요약한다")
  void summarizesForecast() {
    Optional<WeatherSnapshot> snapshot =
        backend(HttpStatus.OK, FORECAST_JSON)
            .fetch("London", LocalDate.of(2026, 5, 30), Duration.ofSeconds(1));

    assertThat(lastRequest.get().url().getPath()).isEqualTo("/data/2.5/forecast");
    assertThat(snapshot)
        .hasValueSatisfying(
            s -> {
              assertThat(s.condition()).isEqualTo("Clouds");
              assertThat(s.minTempCelsius()).isEqualTo(11.4);
              assertThat(s.maxTempCelsius()).isEqualTo(17.6);
              assertThat(s.humidityPercent()).isEqualTo(70);
              assertThat(s.rainExpected()).isTrue();
              assertThat(s.snowExpected()).isFalse();
            });
  }

  @Test
  @DisplayName("먼 미래 여행은 현재 날씨를 대표값으로 사용")
  void usesCurrentWeatherForDistantTrips() {
    Optional<WeatherSnapshot> snapshot =
        backend(HttpStatus.OK, CURRENT_JSON)
            .fetch("Cairo", LocalDate.of(2026, 8, 1), Duration.ofSeconds(1));

    assertThat(lastRequest.get().url().getPath()).isEqualTo("/data/2.5/weather");
    assertThat(lastRequest.get().url().getQuery()).contains("q=Cairo").contains("units=metric");
    assertThat(snapshot)
        .contains(new WeatherSnapshot("clear sky", 22.5, 27.5, 40, false, false));
  }

  @Test
  @DisplayName("알 수 없는 지명(404)은 empty")
  void unknownCityIsEmpty() {
    assertThat(
            backend(HttpStatus.NOT_FOUND, "{\"cod\":\"404\"}")
                .fetch("Atlantis", null, Duration.ofSeconds(1)))
        .isEmpty();
  }

  @Test
  @DisplayName("5xx는 DependencyUnavailable")
  void serverErrorFails() {
    OpenWeatherBackend backend = backend(HttpStatus.BAD_GATEWAY, "{}");

    assertThatThrownBy(() -> backend.fetch("Paris", null, Duration.ofSeconds(1)))
        .isInstanceOf(DependencyUnavailableException.class);
  }
}

package nik.notes.infrastructure.weather;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import nik.notes.core.domain.model.WeatherSnapshot;
import nik.notes.core.port.out.WeatherBackend;
import nik.notes.infrastructure.config.WeatherProperties;
import nik.notes.infrastructure.executor.LogicExecutor;
import nik.notes.infrastructure.executor.TaskContext;
import nik.notes.infrastructure.executor.strategy.ExceptionTranslator;
import nik.notes.infrastructure.weather.dto.OpenWeatherCurrentResponse;
import nik.notes.infrastructure.weather.dto.OpenWeatherCurrentResponse.Condition;
import nik.notes.infrastructure.weather.dto.OpenWeatherForecastResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * OpenWeatherMap 조회
 *
 * <ul>
 *   <li>출발일이 5일 이내(또는 미지정): 5일 예보의 최저/최고 기온, 우세 날씨, 강수 여부
 *   <li>그 이후: 현재 날씨를 대표값으로 사용
 * </ul>
 *
 * <p>알 수 없는 지명(404)은 실패가 아니라 empty입니다.
 */
@Slf4j
@RequiredArgsConstructor
public class OpenWeatherBackend implements WeatherBackend {

  static final String CURRENT_PATH = "/data/2.5/weather";
  static final String FORECAST_PATH = "/data/2.5/forecast";
  private static final int FORECAST_HORIZON_DAYS = 5;
  private static final Set<String> RAIN_CONDITIONS = Set.of("Rain", "Drizzle", "Thunderstorm");
  private static final String SNOW_CONDITION = "Snow";

  private final WebClient weatherWebClient;
  private final WeatherProperties properties;
  private final LogicExecutor executor;
  private final Clock clock;

  @Override
  public Optional<WeatherSnapshot> fetch(String destination, LocalDate startDate, Duration timeout) {
    boolean nearTerm = startDate == null || daysUntil(startDate) <= FORECAST_HORIZON_DAYS;
    return executor.executeWithTranslation(
        () -> nearTerm ? fetchForecast(destination, timeout) : fetchCurrent(destination, timeout),
        ExceptionTranslator.forRemoteCall("weather"),
        TaskContext.of("Weather", nearTerm ? "forecast" : "current"));
  }

  private long daysUntil(LocalDate startDate) {
    return ChronoUnit.DAYS.between(LocalDate.now(clock), startDate);
  }

  private Optional<WeatherSnapshot> fetchCurrent(String destination, Duration timeout) {
    return request(CURRENT_PATH, destination, OpenWeatherCurrentResponse.class, timeout)
        .filter(response -> response.main() != null)
        .map(this::toSnapshot);
  }

  private Optional<WeatherSnapshot> fetchForecast(String destination, Duration timeout) {
    return request(FORECAST_PATH, destination, OpenWeatherForecastResponse.class, timeout)
        .filter(response -> response.list() != null && !response.list().isEmpty())
        .map(this::toSnapshot);
  }

  private <T> Optional<T> request(String path, String destination, Class<T> type, Duration timeout) {
    return weatherWebClient
        .get()
        .uri(
            builder ->
                builder
                    .path(path)
                    .queryParam("q", destination)
                    .queryParam("appid", properties.apiKey())
                    .queryParam("units", properties.units())
                    .queryParam("lang", "en")
                    .build())
        .retrieve()
        .bodyToMono(type)
        .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
        .timeout(timeout)
        .blockOptional();
  }

  WeatherSnapshot toSnapshot(OpenWeatherCurrentResponse response) {
    Condition condition = firstCondition(response.weather());
    String main = condition == null ? "" : condition.main();
    return new WeatherSnapshot(
        condition == null ? "" : condition.description(),
        toCelsius(response.main().tempMin()),
        toCelsius(response.main().tempMax()),
        response.main().humidity(),
        RAIN_CONDITIONS.contains(main),
        SNOW_CONDITION.equals(main));
  }

  WeatherSnapshot toSnapshot(OpenWeatherForecastResponse response) {
    List<OpenWeatherForecastResponse.Entry> entries =
        response.list().stream().filter(e -> e.main() != null).toList();
    List<String> conditions =
        entries.stream()
            .map(e -> firstCondition(e.weather()))
            .filter(Objects::nonNull)
            .map(Condition::main)
            .filter(Objects::nonNull)
            .toList();

    double min = entries.stream().mapToDouble(e -> e.main().temp()).min().orElse(0);
    double max = entries.stream().mapToDouble(e -> e.main().temp()).max().orElse(0);
    int humidity =
        (int) Math.round(entries.stream().mapToInt(e -> e.main().humidity()).average().orElse(0));

    return new WeatherSnapshot(
        dominant(conditions),
        toCelsius(min),
        toCelsius(max),
        humidity,
        conditions.stream().anyMatch(RAIN_CONDITIONS::contains),
        conditions.contains(SNOW_CONDITION));
  }

  private static Condition firstCondition(List<Condition> conditions) {
    return conditions == null || conditions.isEmpty() ? null : conditions.get(0);
  }

  /** 가장 많이 등장한 날씨. 동률이면 사전순으로 앞선 값 */
  private static String dominant(List<String> conditions) {
    Map<String, Long> counts =
        conditions.stream().collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
    return counts.entrySet().stream()
        .sorted(
            Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
        .map(Map.Entry::getKey)
        .findFirst()
        .orElse("");
  }

  private double toCelsius(double value) {
    return "imperial".equalsIgnoreCase(properties.units()) ? (value - 32) * 5 / 9 : value;
  }
}

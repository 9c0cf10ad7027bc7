package nik.notes.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.netty.channel.ChannelOption;
import java.time.Clock;
import java.time.Duration;
import nik.notes.core.port.out.MockBackend;
import nik.notes.core.port.out.TripStore;
import nik.notes.core.suggestion.MockSuggestionGenerator;
import nik.notes.infrastructure.cache.CacheStoreAdapter;
import nik.notes.infrastructure.config.GeminiProperties;
import nik.notes.infrastructure.config.WeatherProperties;
import nik.notes.infrastructure.executor.LogicExecutor;
import nik.notes.infrastructure.generation.GeminiGenerationBackend;
import nik.notes.infrastructure.generation.GenerationBackendAdapter;
import nik.notes.infrastructure.persistence.JdbcTripStore;
import nik.notes.infrastructure.weather.OpenWeatherBackend;
import nik.notes.infrastructure.weather.WeatherContextAdapter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.DefaultUriBuilderFactory;
import reactor.netty.http.client.HttpClient;

/**
 * 외부 의존성(생성 백엔드, 날씨, 관계형 저장소) 어댑터 조립
 *
 * <p>타임아웃 계층:
 *
 * <ul>
 *   <li>connectTimeout: TCP 연결 타임아웃
 *   <li>responseTimeout: 응답 수신 타임아웃 (호출별 timeout과 동일)
 * </ul>
 */
@Configuration
public class ExternalApiConfig {

  @Bean("geminiWebClient")
  public WebClient geminiWebClient(GeminiProperties properties) {
    return webClient(properties.baseUrl(), properties.connectTimeout(), properties.timeout());
  }

  @Bean("weatherWebClient")
  public WebClient weatherWebClient(WeatherProperties properties) {
    return webClient(properties.baseUrl(), properties.connectTimeout(), properties.timeout());
  }

  @Bean
  public GenerationBackendAdapter generationBackend(
      @Qualifier("geminiWebClient") WebClient geminiWebClient,
      @Qualifier("generationCircuitBreaker") CircuitBreaker circuitBreaker,
      GeminiProperties properties,
      LogicExecutor executor,
      Clock clock) {
    return new GenerationBackendAdapter(
        new GeminiGenerationBackend(geminiWebClient, properties, executor),
        circuitBreaker,
        executor,
        clock,
        properties.isConfigured());
  }

  @Bean
  public MockBackend mockBackend() {
    return new MockSuggestionGenerator();
  }

  @Bean
  public WeatherContextAdapter weatherContextAdapter(
      @Qualifier("weatherWebClient") WebClient weatherWebClient,
      @Qualifier("weatherCircuitBreaker") CircuitBreaker circuitBreaker,
      CacheStoreAdapter cacheStoreAdapter,
      ObjectMapper objectMapper,
      WeatherProperties properties,
      LogicExecutor executor,
      Clock clock) {
    return new WeatherContextAdapter(
        new OpenWeatherBackend(weatherWebClient, properties, executor, clock),
        circuitBreaker,
        cacheStoreAdapter,
        objectMapper,
        properties,
        executor,
        clock);
  }

  @Bean
  public TripStore tripStore(JdbcTemplate jdbcTemplate, LogicExecutor executor) {
    return new JdbcTripStore(jdbcTemplate, executor);
  }

  private WebClient webClient(String baseUrl, Duration connectTimeout, Duration responseTimeout) {
    // 쿼리 파라미터(목적지 이름) 값만 인코딩
    DefaultUriBuilderFactory factory = new DefaultUriBuilderFactory(baseUrl);
    factory.setEncodingMode(DefaultUriBuilderFactory.EncodingMode.VALUES_ONLY);

    HttpClient httpClient =
        HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
            .responseTimeout(responseTimeout)
            .compress(true);

    return WebClient.builder()
        .uriBuilderFactory(factory)
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .build();
  }
}

package nik.notes.infrastructure.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/** OpenWeatherMap 설정. API 키가 없으면 날씨 보강은 생략됩니다. */
@ConfigurationProperties(prefix = "weather")
public record WeatherProperties(
    @DefaultValue("") String apiKey,
    @DefaultValue("https://api.openweathermap.org") String baseUrl,
    @DefaultValue("metric") String units,
    @DefaultValue("5s") Duration timeout,
    @DefaultValue("2s") Duration connectTimeout,
    @DefaultValue("24h") Duration cacheTtl,
    @DefaultValue("3") int failureThreshold,
    @DefaultValue("60s") Duration openDuration) {

  public WeatherProperties {
    CacheStoreProperties.requirePositive(timeout, "weather.timeout");
    CacheStoreProperties.requirePositive(cacheTtl, "weather.cache-ttl");
  }

  public boolean isConfigured() {
    return apiKey != null && !apiKey.isBlank();
  }
}

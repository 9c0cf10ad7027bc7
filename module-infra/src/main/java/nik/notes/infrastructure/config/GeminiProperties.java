package nik.notes.infrastructure.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Gemini 생성 백엔드 설정. API 키가 없으면 생성 백엔드는 Unavailable로 고정되고 mock 생성기가 사용됩니다.
 */
@ConfigurationProperties(prefix = "generation.gemini")
public record GeminiProperties(
    @DefaultValue("") String apiKey,
    @DefaultValue("gemini-pro") String model,
    @DefaultValue("https://generativelanguage.googleapis.com") String baseUrl,
    @DefaultValue("8s") Duration timeout,
    @DefaultValue("2s") Duration connectTimeout,
    @DefaultValue("3") int failureThreshold,
    @DefaultValue("60s") Duration openDuration) {

  private static final String PLACEHOLDER_KEY = "your_api_key_here";

  public GeminiProperties {
    CacheStoreProperties.requirePositive(timeout, "generation.gemini.timeout");
    CacheStoreProperties.requirePositive(connectTimeout, "generation.gemini.connect-timeout");
    CacheStoreProperties.requirePositive(openDuration, "generation.gemini.open-duration");
  }

  public boolean isConfigured() {
    return apiKey != null && !apiKey.isBlank() && !PLACEHOLDER_KEY.equals(apiKey);
  }
}

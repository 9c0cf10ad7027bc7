package nik.notes.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 제안 캐싱 설정
 *
 * @param ttl 실제 생성 결과 캐시 TTL
 * @param cacheMockResults mock 결과도 캐시할지 여부
 * @param mockTtl mock 결과 캐시 TTL (cacheMockResults=true일 때만 사용)
 * @param tripMappingPrefix 여행 ID → fingerprint 매핑 키 접두사
 * @param generationTimeout 생성 백엔드 호출 타임아웃 (single-flight generation-timeout 이하)
 */
@ConfigurationProperties(prefix = "suggestion")
public record SuggestionProperties(
    @DefaultValue("24h") Duration ttl,
    @DefaultValue("false") boolean cacheMockResults,
    @DefaultValue("5m") Duration mockTtl,
    @DefaultValue("ai_trip_mapping:") String tripMappingPrefix,
    @DefaultValue("8s") Duration generationTimeout) {

  public SuggestionProperties {
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("suggestion.ttl must be positive");
    }
    if (mockTtl == null || mockTtl.isNegative() || mockTtl.isZero()) {
      throw new IllegalArgumentException("suggestion.mock-ttl must be positive");
    }
    if (generationTimeout == null || generationTimeout.isNegative() || generationTimeout.isZero()) {
      throw new IllegalArgumentException("suggestion.generation-timeout must be positive");
    }
  }
}

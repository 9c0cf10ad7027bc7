package nik.notes.infrastructure.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Single-flight 설정
 *
 * <pre>{@code
 * single-flight:
 *   generation-timeout: 10s   # 이 시간이 지나면 슬롯 강제 해제, 대기자 전원 mock 결과
 *   remote-wait-timeout: 10s  # 다른 인스턴스가 생성 중일 때 캐시 폴링 한도
 *   poll-interval: 100ms
 *   lease-ttl: 30s            # 분산 리스 TTL (인스턴스 장애 시 자동 해제)
 * }</pre>
 */
@ConfigurationProperties(prefix = "single-flight")
public record SingleFlightProperties(
    @DefaultValue("10s") Duration generationTimeout,
    @DefaultValue("10s") Duration remoteWaitTimeout,
    @DefaultValue("100ms") Duration pollInterval,
    @DefaultValue("30s") Duration leaseTtl) {

  public SingleFlightProperties {
    CacheStoreProperties.requirePositive(generationTimeout, "single-flight.generation-timeout");
    CacheStoreProperties.requirePositive(remoteWaitTimeout, "single-flight.remote-wait-timeout");
    CacheStoreProperties.requirePositive(pollInterval, "single-flight.poll-interval");
    CacheStoreProperties.requirePositive(leaseTtl, "single-flight.lease-ttl");
    if (leaseTtl.compareTo(generationTimeout) < 0) {
      throw new IllegalArgumentException("single-flight.lease-ttl must be >= generation-timeout");
    }
  }
}

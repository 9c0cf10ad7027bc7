package nik.notes.config;

import lombok.extern.slf4j.Slf4j;
import nik.notes.infrastructure.config.CacheStoreProperties;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Redisson 단일 서버 클라이언트
 *
 * <p>{@code cache.store.enabled=false}이면 생성하지 않습니다. 이 경우 캐시 백엔드는 Unavailable 구현으로 대체됩니다.
 *
 * <p>{@code @Lazy}: Redis가 내려가 있어도 애플리케이션은 떠야 하므로 {@link CacheStoreConfig}가 요청할 때 생성합니다.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(
    prefix = "cache.store",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class RedissonConfig {

  private static final String REDISSON_HOST_PREFIX = "redis://";

  @Value("${spring.data.redis.host:localhost}")
  private String host;

  @Value("${spring.data.redis.port:6379}")
  private int port;

  @Value("${spring.data.redis.password:}")
  private String password;

  @Lazy
  @Bean(destroyMethod = "shutdown")
  public RedissonClient redissonClient(CacheStoreProperties properties) {
    Config config = new Config();
    int timeoutMillis = (int) properties.operationTimeout().toMillis();

    var server =
        config
            .useSingleServer()
            .setAddress(REDISSON_HOST_PREFIX + host + ":" + port)
            .setTimeout(timeoutMillis)
            .setConnectTimeout(Math.max(timeoutMillis, 1000))
            .setRetryAttempts(0)
            .setConnectionMinimumIdleSize(0)
            .setPingConnectionInterval(0);
    if (!password.isBlank()) {
      server.setPassword(password);
    }

    log.info("[Redisson] Connecting to {}:{}", host, port);
    return Redisson.create(config);
  }
}

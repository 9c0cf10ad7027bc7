package nik.notes.infrastructure.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import nik.notes.core.port.out.CacheBackend;
import nik.notes.infrastructure.executor.LogicExecutor;
import nik.notes.infrastructure.executor.TaskContext;
import nik.notes.infrastructure.executor.strategy.ExceptionTranslator;
import nik.notes.infrastructure.redis.script.LuaScriptProvider;
import nik.notes.infrastructure.util.LogMasking;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.ByteArrayCodec;

/**
 * Redisson 기반 {@link CacheBackend}
 *
 * <ul>
 *   <li>모든 호출은 비동기 API + 명시적 타임아웃으로 대기 (무한 대기 없음)
 *   <li>타임아웃 → DependencyTimeoutException, 그 외 → DependencyUnavailableException
 *   <li>값은 ByteArrayCodec으로 그대로 저장 (직렬화는 상위 어댑터 책임)
 * </ul>
 */
@Slf4j
public class RedissonCacheBackend implements CacheBackend {

  static final String PING_KEY = "{health}:ping";

  private final RedissonClient redissonClient;
  private final LuaScriptProvider scriptProvider;
  private final LogicExecutor executor;
  private final long timeoutMillis;

  public RedissonCacheBackend(
      RedissonClient redissonClient,
      LuaScriptProvider scriptProvider,
      LogicExecutor executor,
      Duration operationTimeout) {
    this.redissonClient = redissonClient;
    this.scriptProvider = scriptProvider;
    this.executor = executor;
    this.timeoutMillis = operationTimeout.toMillis();
  }

  @Override
  public Optional<byte[]> get(String key) {
    return Optional.ofNullable(await(bucket(key).getAsync(), "get", key));
  }

  @Override
  public void set(String key, byte[] value, long ttlSeconds) {
    await(bucket(key).setAsync(value, ttlSeconds, TimeUnit.SECONDS), "set", key);
  }

  @Override
  public boolean setIfAbsent(String key, byte[] value, long ttlSeconds) {
    return Boolean.TRUE.equals(
        await(bucket(key).trySetAsync(value, ttlSeconds, TimeUnit.SECONDS), "setIfAbsent", key));
  }

  @Override
  public boolean deleteIfEquals(String key, byte[] expected) {
    return Boolean.TRUE.equals(
        await(bucket(key).compareAndSetAsync(expected, null), "deleteIfEquals", key));
  }

  @Override
  public boolean delete(String key) {
    return Boolean.TRUE.equals(await(bucket(key).deleteAsync(), "delete", key));
  }

  @Override
  public boolean ping() {
    return executor.executeOrDefault(
        () -> {
          await(redissonClient.getBucket(PING_KEY).isExistsAsync(), "ping", PING_KEY);
          return true;
        },
        false,
        TaskContext.of("Redis", "ping"));
  }

  @Override
  public long incrementWindow(String key, long windowMillis) {
    return executor.executeOrCatch(
        () -> evalWindowIncrement(key, windowMillis),
        e -> retryOnNoScript(e, key, windowMillis),
        TaskContext.of("Redis", "incrementWindow", LogMasking.maskKey(key)));
  }

  private long evalWindowIncrement(String key, long windowMillis) {
    CompletableFuture<Long> counter =
        scriptProvider
            .windowIncrementSha()
            .thenCompose(sha -> scriptProvider.evalWindowIncrement(sha, key, windowMillis));
    Long value = await(counter, "incrementWindow", key);
    return value == null ? 0L : value;
  }

  private long retryOnNoScript(Throwable e, String key, long windowMillis) {
    if (scriptProvider.invalidateIfNoScript(e)) {
      return evalWindowIncrement(key, windowMillis);
    }
    throw (e instanceof RuntimeException re) ? re : new IllegalStateException(e);
  }

  private RBucket<byte[]> bucket(String key) {
    return redissonClient.getBucket(key, ByteArrayCodec.INSTANCE);
  }

  private <T> T await(CompletionStage<T> stage, String operation, String key) {
    CompletableFuture<T> future = stage.toCompletableFuture();
    return executor.executeWithTranslation(
        () -> future.get(timeoutMillis, TimeUnit.MILLISECONDS),
        ExceptionTranslator.forCacheStore(),
        TaskContext.of("Redis", operation, LogMasking.maskKey(key)));
  }
}

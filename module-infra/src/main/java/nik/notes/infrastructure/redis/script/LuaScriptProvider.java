package nik.notes.infrastructure.redis.script;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;

/**
 * Lua Script SHA 캐싱 및 NOSCRIPT 재로드
 *
 * <pre>
 * 1. 최초 호출 시 scriptLoad()로 SHA 확보 (Lazy Loading)
 * 2. evalSha(sha) 호출
 * 3. NOSCRIPT 에러 (Redis 재시작 등) → SHA 폐기 후 재로드
 * </pre>
 *
 * <p>AtomicReference로 SHA를 보관하여 동시 로드 시에도 마지막 값 하나만 남습니다.
 */
@Slf4j
@RequiredArgsConstructor
public class LuaScriptProvider {

  private static final String NOSCRIPT_ERROR_PREFIX = "NOSCRIPT";

  private final RedissonClient redissonClient;
  private final AtomicReference<String> windowIncrementShaRef = new AtomicReference<>();

  /** SHA를 확보한다. 이미 로드되어 있으면 즉시 완료된 Future. */
  public CompletableFuture<String> windowIncrementSha() {
    String cached = windowIncrementShaRef.get();
    if (cached != null) {
      return CompletableFuture.completedFuture(cached);
    }
    return script()
        .scriptLoadAsync(LuaScripts.FIXED_WINDOW_INCREMENT)
        .toCompletableFuture()
        .thenApply(
            sha -> {
              windowIncrementShaRef.set(sha);
              log.info("[LuaScriptProvider] Window increment script loaded: {}", sha);
              return sha;
            });
  }

  public CompletableFuture<Long> evalWindowIncrement(String sha, String key, long windowMillis) {
    return script()
        .<Long>evalShaAsync(
            RScript.Mode.READ_WRITE,
            sha,
            RScript.ReturnType.INTEGER,
            List.<Object>of(key),
            String.valueOf(windowMillis))
        .toCompletableFuture();
  }

  /** NOSCRIPT 에러면 캐시된 SHA를 폐기하고 true를 반환한다. */
  public boolean invalidateIfNoScript(Throwable error) {
    for (Throwable current = error; current != null; current = current.getCause()) {
      String message = current.getMessage();
      if (message != null && message.contains(NOSCRIPT_ERROR_PREFIX)) {
        windowIncrementShaRef.set(null);
        log.warn("[LuaScriptProvider] NOSCRIPT detected, script will be reloaded");
        return true;
      }
      if (current.getCause() == current) {
        break;
      }
    }
    return false;
  }

  private RScript script() {
    return redissonClient.getScript(StringCodec.INSTANCE);
  }
}

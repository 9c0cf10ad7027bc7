package nik.notes.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import nik.notes.core.domain.model.CacheEntry;
import nik.notes.infrastructure.executor.LogicExecutor;
import nik.notes.infrastructure.executor.TaskContext;
import nik.notes.infrastructure.util.LogMasking;

/**
 * {@link CacheEntry} ↔ 저장 바이트 변환 (Jackson JSON)
 *
 * <p>createdAt/ttl을 값 안에 같이 저장해야 저장소 TTL과 무관하게 읽기 시점에 만료를 다시 판정할 수 있습니다. 디코딩 실패는 miss로 취급합니다.
 */
@RequiredArgsConstructor
public class CacheEnvelopeCodec {

  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;

  public byte[] encode(CacheEntry entry) {
    CacheEnvelope envelope =
        new CacheEnvelope(
            entry.key(),
            entry.payload(),
            entry.createdAt().toEpochMilli(),
            entry.ttl().toMillis());
    return executor.execute(
        () -> objectMapper.writeValueAsBytes(envelope),
        TaskContext.of("CacheEnvelope", "encode", LogMasking.maskKey(entry.key())));
  }

  public Optional<CacheEntry> decode(String key, byte[] bytes) {
    return executor.executeOrDefault(
        () -> Optional.of(objectMapper.readValue(bytes, CacheEnvelope.class).toEntry()),
        Optional.empty(),
        TaskContext.of("CacheEnvelope", "decode", LogMasking.maskKey(key)));
  }

  public record CacheEnvelope(String key, byte[] payload, long createdAtEpochMillis, long ttlMillis) {

    CacheEntry toEntry() {
      return new CacheEntry(
          key, payload, Instant.ofEpochMilli(createdAtEpochMillis), Duration.ofMillis(ttlMillis));
    }
  }
}

package nik.notes.service.suggestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import nik.notes.core.domain.model.SuggestionList;
import nik.notes.core.domain.model.SuggestionSource;
import nik.notes.infrastructure.executor.LogicExecutor;
import nik.notes.infrastructure.executor.TaskContext;
import org.springframework.stereotype.Component;

/**
 * {@link SuggestionList} ↔ 캐시 payload(JSON) 변환
 *
 * <p>source 태그를 payload에 함께 저장하여 mock 결과가 실제 생성 결과로 읽히지 않도록 합니다.
 */
@Component
@RequiredArgsConstructor
public class SuggestionPayloadCodec {

  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;

  public byte[] encode(SuggestionList suggestions) {
    SuggestionPayload payload =
        new SuggestionPayload(suggestions.items(), suggestions.source().name());
    return executor.execute(
        () -> objectMapper.writeValueAsBytes(payload),
        TaskContext.of("SuggestionCodec", "encode"));
  }

  /** 디코딩할 수 없는 payload는 캐시 미스로 취급합니다. */
  public Optional<SuggestionList> decode(byte[] bytes) {
    return executor.executeOrDefault(
        () -> Optional.of(objectMapper.readValue(bytes, SuggestionPayload.class).toSuggestions()),
        Optional.empty(),
        TaskContext.of("SuggestionCodec", "decode"));
  }

  public record SuggestionPayload(List<String> items, String source) {

    SuggestionList toSuggestions() {
      return new SuggestionList(items, SuggestionSource.valueOf(source));
    }
  }
}

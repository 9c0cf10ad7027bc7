package nik.notes.infrastructure.generation;

import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import nik.notes.core.domain.model.RequestParameters;
import nik.notes.core.domain.model.SuggestionList;
import nik.notes.core.port.out.GenerationBackend;
import nik.notes.core.suggestion.SuggestionLineParser;
import nik.notes.error.exception.GenerationFailureException;
import nik.notes.infrastructure.config.GeminiProperties;
import nik.notes.infrastructure.executor.LogicExecutor;
import nik.notes.infrastructure.executor.TaskContext;
import nik.notes.infrastructure.executor.strategy.ExceptionTranslator;
import nik.notes.infrastructure.generation.dto.GeminiRequest;
import nik.notes.infrastructure.generation.dto.GeminiResponse;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Gemini generateContent 호출 (Anti-Corruption Layer)
 *
 * <p>외부 응답 텍스트를 "N x Item" 라인 목록으로 변환합니다. 파싱 가능한 라인이 하나도 없으면 {@link
 * GenerationFailureException}.
 */
@Slf4j
@RequiredArgsConstructor
public class GeminiGenerationBackend implements GenerationBackend {

  static final String GENERATE_PATH = "/v1beta/models/{model}:generateContent";

  private final WebClient geminiWebClient;
  private final GeminiProperties properties;
  private final LogicExecutor executor;

  @Override
  public SuggestionList generate(RequestParameters params, Duration timeout) {
    return executor.executeWithTranslation(
        () -> requestSuggestions(params, timeout),
        ExceptionTranslator.forRemoteCall("generation-backend"),
        TaskContext.of("Gemini", "generate", properties.model()));
  }

  private SuggestionList requestSuggestions(RequestParameters params, Duration timeout) {
    GeminiResponse response =
        geminiWebClient
            .post()
            .uri(
                builder ->
                    builder
                        .path(GENERATE_PATH)
                        .queryParam("key", properties.apiKey())
                        .build(properties.model()))
            .bodyValue(GeminiRequest.ofPrompt(GeminiPromptBuilder.build(params)))
            .retrieve()
            .bodyToMono(GeminiResponse.class)
            .timeout(timeout)
            .block();

    String text = response == null ? "" : response.firstCandidateText();
    List<String> items = SuggestionLineParser.parse(text);
    if (items.isEmpty()) {
      throw new GenerationFailureException("no parsable suggestion lines in response");
    }
    log.debug("[Gemini] Parsed {} suggestion lines", items.size());
    return SuggestionList.generated(items);
  }
}

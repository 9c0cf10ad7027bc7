package nik.notes.infrastructure.generation.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Gemini generateContent 응답 (필요한 필드만 매핑) */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeminiResponse(List<Candidate> candidates) {

  /** 첫 번째 후보의 텍스트 파트를 이어 붙인 결과. 후보가 없으면 빈 문자열 */
  public String firstCandidateText() {
    if (candidates == null || candidates.isEmpty()) {
      return "";
    }
    Candidate first = candidates.get(0);
    if (first == null || first.content() == null || first.content().parts() == null) {
      return "";
    }
    return first.content().parts().stream()
        .map(Part::text)
        .filter(Objects::nonNull)
        .collect(Collectors.joining("\n"));
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Candidate(Content content, String finishReason) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Content(List<Part> parts) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Part(String text) {}
}

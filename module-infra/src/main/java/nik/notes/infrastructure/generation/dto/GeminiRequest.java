package nik.notes.infrastructure.generation.dto;

import java.util.List;

/** Gemini generateContent 요청 본문 */
public record GeminiRequest(List<Content> contents) {

  public static GeminiRequest ofPrompt(String prompt) {
    return new GeminiRequest(List.of(new Content(List.of(new Part(prompt)))));
  }

  public record Content(List<Part> parts) {}

  public record Part(String text) {}
}

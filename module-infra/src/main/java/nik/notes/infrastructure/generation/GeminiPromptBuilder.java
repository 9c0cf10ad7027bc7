package nik.notes.infrastructure.generation;

import nik.notes.core.domain.model.RequestParameters;

/** 짐 목록 생성 프롬프트. 응답은 한 줄에 "QUANTITY x ITEM_NAME" 형식을 요구한다. */
public final class GeminiPromptBuilder {

  private GeminiPromptBuilder() {}

  public static String build(RequestParameters params) {
    int days = params.durationDays();
    int travelers = params.travelers().total();

    StringBuilder prompt = new StringBuilder();
    prompt.append("Generate a comprehensive packing list for the following trip:\n\n");
    prompt.append("Destination: ").append(params.destination()).append('\n');
    prompt.append("Duration: ").append(days).append(" days\n");
    prompt.append("Number of travelers: ").append(travelers).append('\n');
    prompt.append("Travel style: ").append(params.travelStyle().value()).append('\n');
    prompt.append("Transportation: ").append(params.transportMethod().value()).append('\n');
    if (params.startDate() != null) {
      prompt.append("Start date: ").append(params.startDate()).append('\n');
    }
    if (!params.activities().isEmpty()) {
      prompt.append("Activities: ").append(String.join(", ", params.activities())).append('\n');
    }
    if (params.hasWeather()) {
      prompt.append("Weather: ").append(params.weather().summary()).append('\n');
    }

    prompt.append("\n\nIMPORTANT: For each item, suggest smart quantities based on:\n");
    prompt.append("- Trip duration (").append(days).append(" days)\n");
    prompt.append("- Number of travelers (").append(travelers).append(" person(s))\n");
    prompt.append(
        "- Item shareability (e.g., toothpaste can be shared, but toothbrushes cannot)\n\n");
    prompt.append("Format each line EXACTLY as: \"QUANTITY x ITEM_NAME\"\n");
    prompt.append("Examples:\n");
    prompt.append("- \"").append(days).append(" x Pairs of socks\" (one per day)\n");
    prompt.append("- \"").append(travelers).append(" x Toothbrush\" (one per person)\n");
    prompt.append("- \"1 x Toothpaste\" (shared among all travelers)\n");
    prompt.append("- \"").append(travelers * 2).append(" x Underwear\" (multiple per person)\n\n");
    prompt.append("Provide the complete packing list with smart quantities, one item per line.\n");
    return prompt.toString();
  }
}

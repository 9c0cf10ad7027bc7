package nik.notes.controller.dto;

import java.util.List;
import java.util.Locale;
import nik.notes.core.domain.model.SuggestionList;

/**
 * @param suggestions {@code "QUANTITY x ITEM"} 형식의 항목
 * @param source {@code generated} 또는 {@code mock}
 * @param count 항목 수
 */
public record SuggestionResponse(List<String> suggestions, String source, int count) {

  public static SuggestionResponse from(SuggestionList list) {
    return new SuggestionResponse(
        list.items(), list.source().name().toLowerCase(Locale.ROOT), list.size());
  }
}

package nik.notes.core.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered suggestion lines ({@code "QUANTITY x ITEM"}) with their source.
 *
 * <p>The source travels with the list (and with its cached payload), so a substitute result is
 * never mistaken for a confirmed generated one.
 */
public record SuggestionList(List<String> items, SuggestionSource source) {

  public SuggestionList {
    items = List.copyOf(items);
    Objects.requireNonNull(source, "source");
  }

  public static SuggestionList generated(List<String> items) {
    return new SuggestionList(items, SuggestionSource.GENERATED);
  }

  public static SuggestionList mock(List<String> items) {
    return new SuggestionList(items, SuggestionSource.MOCK);
  }

  public boolean isMock() {
    return source == SuggestionSource.MOCK;
  }

  public int size() {
    return items.size();
  }
}

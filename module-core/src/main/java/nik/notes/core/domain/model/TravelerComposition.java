package nik.notes.core.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Traveler counts per {@link TravelerType}.
 *
 * <p>Zero counts are dropped, so two compositions with the same non-zero counts are equal. An
 * omitted (null or all-zero) composition means one adult. Negative counts are kept so that
 * validation can reject them.
 *
 * @param counts immutable count per type, iteration in enum order
 */
public record TravelerComposition(Map<TravelerType, Integer> counts) {

  public TravelerComposition {
    EnumMap<TravelerType, Integer> copy = new EnumMap<>(TravelerType.class);
    if (counts != null) {
      counts.forEach(
          (type, count) -> {
            if (type != null && count != null && count != 0) {
              copy.put(type, count);
            }
          });
    }
    if (copy.isEmpty()) {
      copy.put(TravelerType.ADULT, 1);
    }
    counts = Collections.unmodifiableMap(copy);
  }

  public static TravelerComposition oneAdult() {
    return new TravelerComposition(Map.of(TravelerType.ADULT, 1));
  }

  public static TravelerComposition of(Map<TravelerType, Integer> counts) {
    return new TravelerComposition(counts);
  }

  public int count(TravelerType type) {
    return counts.getOrDefault(type, 0);
  }

  public int total() {
    return counts.values().stream().mapToInt(Integer::intValue).sum();
  }

  public boolean hasNegativeCount() {
    return counts.values().stream().anyMatch(count -> count < 0);
  }
}

package nik.notes.core.port.out;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;
import nik.notes.core.domain.model.WeatherSnapshot;

/** Port to the auxiliary weather provider. */
public interface WeatherBackend {

  /**
   * @param destination free-text destination
   * @param startDate first trip day, {@code null} for current conditions
   * @param timeout upper bound for the whole lookup
   * @return snapshot, or empty when the provider knows nothing about the destination
   */
  Optional<WeatherSnapshot> fetch(String destination, LocalDate startDate, Duration timeout);
}

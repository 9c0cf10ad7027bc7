package nik.notes.infrastructure.persistence;

import com.google.common.base.Splitter;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import nik.notes.core.domain.model.TransportMethod;
import nik.notes.core.domain.model.TravelStyle;
import nik.notes.core.domain.model.TravelerComposition;
import nik.notes.core.domain.model.TravelerType;
import nik.notes.core.domain.model.TripRecord;
import nik.notes.core.port.out.TripStore;
import nik.notes.infrastructure.executor.LogicExecutor;
import nik.notes.infrastructure.executor.TaskContext;
import nik.notes.infrastructure.executor.strategy.ExceptionTranslator;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * 여행 정보 조회 (JdbcTemplate)
 *
 * <p>영속 저장소는 필수 의존성입니다. 연결/쿼리 실패는 {@link nik.notes.error.exception.StoreFailureException}으로
 * 변환되어 호출자에게 전파됩니다.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcTripStore implements TripStore {

  static final String SELECT_TRIP =
      "SELECT id, destination, start_date, end_date, travel_style, transport_method, activities"
          + " FROM trips WHERE id = ?";
  static final String SELECT_TRAVELERS =
      "SELECT traveler_type, COUNT(*) AS cnt FROM travelers WHERE trip_id = ? GROUP BY traveler_type";

  private static final Splitter ACTIVITY_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private final JdbcTemplate jdbcTemplate;
  private final LogicExecutor executor;

  @Override
  public Optional<TripRecord> findById(long tripId) {
    return executor.executeWithTranslation(
        () -> loadTrip(tripId),
        ExceptionTranslator.forDurableStore(),
        TaskContext.of("TripStore", "findById", String.valueOf(tripId)));
  }

  private Optional<TripRecord> loadTrip(long tripId) {
    List<TripRow> rows = jdbcTemplate.query(SELECT_TRIP, (rs, rowNum) -> mapTrip(rs), tripId);
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    TripRow row = rows.get(0);
    return Optional.of(
        new TripRecord(
            row.id(),
            row.destination(),
            row.startDate(),
            row.endDate(),
            TravelStyle.fromValue(row.travelStyle()),
            TransportMethod.fromValue(row.transportMethod()),
            loadTravelers(tripId),
            splitActivities(row.activities())));
  }

  private TravelerComposition loadTravelers(long tripId) {
    Map<TravelerType, Integer> counts = new EnumMap<>(TravelerType.class);
    jdbcTemplate.query(
        SELECT_TRAVELERS,
        rs -> {
          counts.merge(
              TravelerType.fromValue(rs.getString("traveler_type")),
              rs.getInt("cnt"),
              Integer::sum);
        },
        tripId);
    return TravelerComposition.of(counts);
  }

  private static TripRow mapTrip(ResultSet rs) throws SQLException {
    return new TripRow(
        rs.getLong("id"),
        rs.getString("destination"),
        toLocalDate(rs.getDate("start_date")),
        toLocalDate(rs.getDate("end_date")),
        rs.getString("travel_style"),
        rs.getString("transport_method"),
        rs.getString("activities"));
  }

  private static LocalDate toLocalDate(Date date) {
    return date == null ? null : date.toLocalDate();
  }

  /** activities 컬럼은 쉼표 구분 문자열 */
  private static List<String> splitActivities(String raw) {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    return ACTIVITY_SPLITTER.splitToList(raw);
  }

  private record TripRow(
      long id,
      String destination,
      LocalDate startDate,
      LocalDate endDate,
      String travelStyle,
      String transportMethod,
      String activities) {}
}

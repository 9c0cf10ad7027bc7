package nik.notes.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.util.List;
import nik.notes.core.domain.model.TransportMethod;
import nik.notes.core.domain.model.TravelStyle;
import nik.notes.core.domain.model.TravelerType;
import nik.notes.core.domain.model.TripRecord;
import nik.notes.error.exception.StoreFailureException;
import nik.notes.infrastructure.executor.DefaultLogicExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

@Tag("unit")
@DisplayName("JdbcTripStore")
class JdbcTripStoreTest {

  private EmbeddedDatabase database;
  private JdbcTripStore store;

  @BeforeEach
  void setUp() {
    database =
        new EmbeddedDatabaseBuilder()
            .setType(EmbeddedDatabaseType.H2)
            .generateUniqueName(true)
            .addScript("trip-schema.sql")
            .addScript("trip-data.sql")
            .build();
    store = new JdbcTripStore(new JdbcTemplate(database), new DefaultLogicExecutor());
  }

  @AfterEach
  void tearDown() {
    database.shutdown();
  }

  @Test
  @DisplayName("여행과 동행자 구성을 함께 읽는다")
  void loadsTripWithTravelers() {
    TripRecord trip = store.findById(1L).orElseThrow();

    assertThat(trip.destination()).isEqualTo("Paris");
    assertThat(trip.startDate()).isEqualTo(LocalDate.of(2026, 7, 1));
    assertThat(trip.durationDays()).isEqualTo(5);
    assertThat(trip.travelStyle()).isEqualTo(TravelStyle.LEISURE);
    assertThat(trip.transportMethod()).isEqualTo(TransportMethod.FLIGHT);
    assertThat(trip.travelers().count(TravelerType.ADULT)).isEqualTo(2);
    assertThat(trip.travelers().count(TravelerType.CHILD)).isEqualTo(1);
    assertThat(trip.activities()).isEqualTo(List.of("museums", "food tours"));
  }

  @Test
  @DisplayName("동행자 행이 없으면 성인 1명")
  void defaultsToOneAdult() {
    TripRecord trip = store.findById(2L).orElseThrow();

    assertThat(trip.travelers().total()).isEqualTo(1);
    assertThat(trip.activities()).isEmpty();
  }

  @Test
  @DisplayName("activities의 공백과 빈 항목은 버린다")
  void trimsActivitiesAndDropsEmptyEntries() {
    TripRecord trip = store.findById(3L).orElseThrow();

    assertThat(trip.activities()).isEqualTo(List.of("hiking", "fjord cruise"));
  }

  @Test
  @DisplayName("없는 여행은 empty")
  void missingTrip() {
    assertThat(store.findById(999L)).isEmpty();
  }

  @Test
  @DisplayName("저장소 장애는 StoreFailure로 전파")
  void storeFailurePropagates() {
    database.shutdown();

    assertThatThrownBy(() -> store.findById(1L)).isInstanceOf(StoreFailureException.class);
  }
}

package nik.notes.core.suggestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import nik.notes.core.domain.model.RequestParameters;
import nik.notes.core.domain.model.TravelerComposition;
import nik.notes.core.domain.model.TravelerType;
import nik.notes.core.domain.model.WeatherSnapshot;
import nik.notes.error.exception.InvalidRequestParametersException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@Tag("unit")
class RequestParametersValidatorTest {

  private static RequestParameters.RequestParametersBuilder valid() {
    return RequestParameters.builder().destination("Paris").durationDays(5);
  }

  @Test
  @DisplayName("정상 요청은 그대로 반환된다")
  void validPasses() {
    RequestParameters params = valid().build();

    assertThat(RequestParametersValidator.validate(params)).isSameAs(params);
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "   ", "<script>", "Paris {x}"})
  @DisplayName("빈 목적지나 의심 문자는 거부된다")
  void invalidDestination(String destination) {
    assertThatThrownBy(() -> RequestParametersValidator.validate(valid().destination(destination).build()))
        .isInstanceOf(InvalidRequestParametersException.class);
  }

  @Test
  @DisplayName("null 목적지는 거부된다")
  void nullDestination() {
    assertThatThrownBy(() -> RequestParametersValidator.validate(valid().destination(null).build()))
        .isInstanceOf(InvalidRequestParametersException.class)
        .hasMessageContaining("destination");
  }

  @ParameterizedTest
  @ValueSource(ints = {0, -1, 366})
  @DisplayName("일수는 1~365")
  void invalidDuration(int days) {
    assertThatThrownBy(() -> RequestParametersValidator.validate(valid().durationDays(days).build()))
        .isInstanceOf(InvalidRequestParametersException.class)
        .hasMessageContaining("duration");
  }

  @Test
  @DisplayName("인원수는 20명 이하이며 음수는 허용하지 않는다")
  void travelers() {
    RequestParameters tooMany =
        valid().travelers(TravelerComposition.of(Map.of(TravelerType.ADULT, 21))).build();
    RequestParameters negative =
        valid()
            .travelers(TravelerComposition.of(Map.of(TravelerType.ADULT, 2, TravelerType.CHILD, -1)))
            .build();

    assertThatThrownBy(() -> RequestParametersValidator.validate(tooMany))
        .isInstanceOf(InvalidRequestParametersException.class);
    assertThatThrownBy(() -> RequestParametersValidator.validate(negative))
        .isInstanceOf(InvalidRequestParametersException.class);
  }

  @Test
  @DisplayName("활동은 20개 이하")
  void activities() {
    RequestParameters params = valid().activities(Collections.nCopies(21, "hiking")).build();

    assertThatThrownBy(() -> RequestParametersValidator.validate(params))
        .isInstanceOf(InvalidRequestParametersException.class);
    assertThat(RequestParametersValidator.validate(valid().activities(List.of("hiking")).build()))
        .isNotNull();
  }

  @Test
  @DisplayName("날씨 값 범위 검증")
  void weather() {
    RequestParameters humid =
        valid().weather(new WeatherSnapshot("fog", 5, 9, 120, false, false)).build();
    RequestParameters inverted =
        valid().weather(new WeatherSnapshot("fog", 10, 2, 50, false, false)).build();

    assertThatThrownBy(() -> RequestParametersValidator.validate(humid))
        .isInstanceOf(InvalidRequestParametersException.class);
    assertThatThrownBy(() -> RequestParametersValidator.validate(inverted))
        .isInstanceOf(InvalidRequestParametersException.class);
  }
}

package nik.notes.core.suggestion;

import java.util.regex.Pattern;
import nik.notes.core.domain.model.RequestParameters;
import nik.notes.core.domain.model.WeatherSnapshot;
import nik.notes.error.exception.InvalidRequestParametersException;

/**
 * 추천 요청 파라미터 검증
 *
 * <p>캐시/생성 백엔드에 접근하기 전에 호출되며, 첫 번째 위반 사항으로 {@link InvalidRequestParametersException}을 던집니다.
 */
public final class RequestParametersValidator {

  static final int MAX_DESTINATION_LENGTH = 200;
  static final int MAX_DURATION_DAYS = 365;
  static final int MAX_TRAVELERS = 20;
  static final int MAX_ACTIVITIES = 20;
  static final int MAX_ACTIVITY_LENGTH = 100;

  private static final Pattern SUSPICIOUS = Pattern.compile("[<>{}]");

  private RequestParametersValidator() {}

  public static RequestParameters validate(RequestParameters params) {
    if (params == null) {
      throw new InvalidRequestParametersException("request parameters are required");
    }
    validateDestination(params.destination());
    if (params.durationDays() < 1 || params.durationDays() > MAX_DURATION_DAYS) {
      throw new InvalidRequestParametersException(
          "duration must be between 1 and " + MAX_DURATION_DAYS + " days");
    }
    if (params.travelers().hasNegativeCount()) {
      throw new InvalidRequestParametersException("traveler counts must not be negative");
    }
    int travelers = params.travelers().total();
    if (travelers < 1 || travelers > MAX_TRAVELERS) {
      throw new InvalidRequestParametersException(
          "between 1 and " + MAX_TRAVELERS + " travelers are allowed");
    }
    validateActivities(params);
    if (params.weather() != null) {
      validateWeather(params.weather());
    }
    return params;
  }

  private static void validateDestination(String destination) {
    if (destination == null || destination.isBlank()) {
      throw new InvalidRequestParametersException("destination cannot be empty");
    }
    if (destination.strip().length() > MAX_DESTINATION_LENGTH) {
      throw new InvalidRequestParametersException(
          "destination is longer than " + MAX_DESTINATION_LENGTH + " characters");
    }
    if (SUSPICIOUS.matcher(destination).find()) {
      throw new InvalidRequestParametersException("destination contains invalid characters");
    }
  }

  private static void validateActivities(RequestParameters params) {
    if (params.activities().size() > MAX_ACTIVITIES) {
      throw new InvalidRequestParametersException(
          "at most " + MAX_ACTIVITIES + " activities are allowed");
    }
    for (String activity : params.activities()) {
      if (activity.length() > MAX_ACTIVITY_LENGTH || SUSPICIOUS.matcher(activity).find()) {
        throw new InvalidRequestParametersException("invalid activity '" + activity + "'");
      }
    }
  }

  private static void validateWeather(WeatherSnapshot weather) {
    if (weather.humidityPercent() < 0 || weather.humidityPercent() > 100) {
      throw new InvalidRequestParametersException("humidity must be between 0 and 100");
    }
    if (weather.minTempCelsius() > weather.maxTempCelsius()) {
      throw new InvalidRequestParametersException("minimum temperature exceeds maximum");
    }
  }
}

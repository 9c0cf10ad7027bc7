package nik.notes.core.fingerprint;

import com.google.common.base.CharMatcher;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import nik.notes.core.domain.model.Fingerprint;
import nik.notes.core.domain.model.RequestParameters;
import nik.notes.core.domain.model.TravelerType;
import nik.notes.core.domain.model.WeatherSnapshot;

/**
 * RequestParameters → {@link Fingerprint} 변환 (순수 함수)
 *
 * <h3>정규화 규칙</h3>
 *
 * <ul>
 *   <li>문자열: NFKC 정규화, 앞뒤 공백 제거, 연속 공백 1칸으로 축약, 소문자화
 *   <li>활동 목록: 정규화 후 빈 값 제거, 중복 제거, 정렬
 *   <li>날씨: 기온은 1°C 단위 반올림, 습도는 5% 단위 반올림
 *   <li>자유 텍스트 필드는 길이 접두사로 인코딩하여 구분자 충돌을 막음
 * </ul>
 *
 * <h3>해시</h3>
 *
 * <p>MurmurHash3 128-bit (Guava). 비암호학적 해시이며 캐시 키 외 용도로 사용하지 않습니다. 프로세스별 salt가 없으므로 재시작 후에도
 * 동일한 키가 나옵니다.
 */
public final class FingerprintDeriver {

  private static final HashFunction HASH = Hashing.murmur3_128();
  private static final String UNKNOWN = "unknown";

  private FingerprintDeriver() {}

  public static Fingerprint derive(RequestParameters params) {
    String canonical = canonicalize(params);
    return Fingerprint.ofDigest(HASH.hashString(canonical, StandardCharsets.UTF_8).toString());
  }

  /** Canonical text form hashed by {@link #derive}. Visible for diagnostics and tests. */
  public static String canonicalize(RequestParameters params) {
    Objects.requireNonNull(params, "params");
    return String.join(
        "|",
        "dest=" + text(params.destination()),
        "start=" + (params.startDate() == null ? UNKNOWN : params.startDate().toString()),
        "days=" + params.durationDays(),
        "style=" + params.travelStyle().value(),
        "transport=" + params.transportMethod().value(),
        "activities=" + activities(params),
        "weather=" + weather(params.weather()),
        "travelers=" + travelers(params.travelers().counts()));
  }

  static String normalize(String raw) {
    if (raw == null) {
      return "";
    }
    String nfkc = Normalizer.normalize(raw, Normalizer.Form.NFKC);
    return CharMatcher.whitespace().trimAndCollapseFrom(nfkc, ' ').toLowerCase(Locale.ROOT);
  }

  private static String text(String raw) {
    String normalized = normalize(raw);
    return normalized.length() + ":" + normalized;
  }

  private static String activities(RequestParameters params) {
    return params.activities().stream()
        .map(FingerprintDeriver::normalize)
        .filter(activity -> !activity.isEmpty())
        .distinct()
        .sorted()
        .map(activity -> activity.length() + ":" + activity)
        .collect(Collectors.joining(",", "[", "]"));
  }

  private static String weather(WeatherSnapshot weather) {
    if (weather == null) {
      return UNKNOWN;
    }
    return text(weather.condition())
        + ";"
        + Math.round(weather.minTempCelsius())
        + ";"
        + Math.round(weather.maxTempCelsius())
        + ";"
        + quantizeHumidity(weather.humidityPercent())
        + ";"
        + weather.rainExpected()
        + ";"
        + weather.snowExpected();
  }

  static int quantizeHumidity(int humidityPercent) {
    return Math.round(humidityPercent / 5.0f) * 5;
  }

  private static String travelers(Map<TravelerType, Integer> counts) {
    // EnumMap 순서 = enum 선언 순서
    return counts.entrySet().stream()
        .map(e -> e.getKey().value() + ":" + e.getValue())
        .collect(Collectors.joining(","));
  }
}

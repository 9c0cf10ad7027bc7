package nik.notes.core.suggestion;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 생성 백엔드 응답 텍스트 → 추천 라인 목록
 *
 * <p>각 줄 앞의 글머리 기호, 번호, 점, 공백을 제거한 뒤 {@code QUANTITY x ITEM} 형식의 줄만 남깁니다.
 */
public final class SuggestionLineParser {

  private static final Pattern QUANTITY_LINE =
      Pattern.compile("^\\d+\\s*x\\s*.+", Pattern.CASE_INSENSITIVE);
  private static final CharMatcher BULLETS = CharMatcher.anyOf("•-* ");
  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  private SuggestionLineParser() {}

  public static List<String> parse(String responseText) {
    if (responseText == null || responseText.isBlank()) {
      return List.of();
    }
    return Splitter.onPattern("\r?\n")
        .trimResults()
        .omitEmptyStrings()
        .splitToStream(responseText)
        .map(SuggestionLineParser::clean)
        .filter(line -> !line.isEmpty() && QUANTITY_LINE.matcher(line).matches())
        .collect(Collectors.toList());
  }

  /**
   * Strips list decoration while keeping the leading quantity.
   *
   * <p>"3. 2 x Socks" becomes "2 x Socks"; "- 2 x Socks" becomes "2 x Socks".
   */
  static String clean(String line) {
    String withoutBullets = BULLETS.trimLeadingFrom(line);
    // 수량도 숫자로 시작하므로 "번호." 형태일 때만 번호를 제거한다
    int index = 0;
    while (index < withoutBullets.length() && DIGITS.matches(withoutBullets.charAt(index))) {
      index++;
    }
    if (index < withoutBullets.length() && withoutBullets.charAt(index) == '.') {
      return CharMatcher.whitespace().trimLeadingFrom(withoutBullets.substring(index + 1));
    }
    return withoutBullets;
  }
}

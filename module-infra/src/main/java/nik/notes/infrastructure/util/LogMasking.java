package nik.notes.infrastructure.util;

/** 로그에 남기는 캐시 키/식별자 마스킹 */
public final class LogMasking {

  private static final int VISIBLE_CHARS = 8;

  private LogMasking() {}

  /**
   * 네임스페이스(마지막 ':'까지)는 그대로 두고 나머지는 앞 8자만 노출합니다.
   *
   * <p>{@code ai_suggestions:3f2a9c01d4...} → {@code ai_suggestions:3f2a9c01****}
   */
  public static String maskKey(String key) {
    if (key == null) {
      return "null";
    }
    int namespaceEnd = key.lastIndexOf(':') + 1;
    String tail = key.substring(namespaceEnd);
    if (tail.length() <= VISIBLE_CHARS) {
      return key;
    }
    return key.substring(0, namespaceEnd) + tail.substring(0, VISIBLE_CHARS) + "****";
  }

  /** IP, 사용자 ID 등 식별자는 앞 절반만 노출합니다. */
  public static String maskIdentity(String identity) {
    if (identity == null || identity.length() < 4) {
      return "****";
    }
    return identity.substring(0, identity.length() / 2) + "****";
  }
}

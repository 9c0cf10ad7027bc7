package nik.notes.infrastructure.redis.script;

/** Redis Lua 스크립트 원문 */
public final class LuaScripts {

  private LuaScripts() {}

  /**
   * 고정 윈도우 카운터 증가
   *
   * <p>KEYS[1] = 윈도우 키 (윈도우 시작 시각 포함), ARGV[1] = 윈도우 길이(ms). 첫 증가 시에만 만료를 설정하므로 INCR과 PEXPIRE가
   * 원자적으로 묶입니다.
   *
   * @return 증가 후 카운터 값
   */
  public static final String FIXED_WINDOW_INCREMENT =
      """
      local current = redis.call('INCR', KEYS[1])
      if current == 1 then
        redis.call('PEXPIRE', KEYS[1], ARGV[1])
      end
      return current
      """;
}

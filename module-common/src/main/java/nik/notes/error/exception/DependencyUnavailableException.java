package nik.notes.error.exception;

import nik.notes.error.CommonErrorCode;
import nik.notes.error.exception.base.ServerBaseException;

/**
 * 선택적 의존 서비스(캐시, 생성 백엔드, 날씨)를 사용할 수 없음
 *
 * <p>어댑터 내부에서 복구되며 호출자에게 전파되지 않습니다.
 */
public class DependencyUnavailableException extends ServerBaseException {

  public DependencyUnavailableException(String dependency) {
    super(CommonErrorCode.DEPENDENCY_UNAVAILABLE, dependency);
  }

  public DependencyUnavailableException(String dependency, Throwable cause) {
    super(CommonErrorCode.DEPENDENCY_UNAVAILABLE, cause, dependency);
  }
}

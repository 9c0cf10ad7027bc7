package nik.notes.error.exception.base;

import nik.notes.error.ErrorCode;

/**
 * ServerBaseException: 의존 서비스 장애나 내부 오류로 발생하는 5xx 계열 예외입니다. 장애 회고를 위한 상세 로그(cause 포함)를 남기는 것이
 * 주 목적입니다.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}

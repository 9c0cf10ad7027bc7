package nik.notes.error.exception.base;

import nik.notes.error.ErrorCode;

/**
 * ClientBaseException: 호출자의 입력이나 사용 한도 때문에 발생하는 4xx 계열 예외입니다. 호출자에게 구체적인 실패 원인을 전달하는 것이
 * 목적입니다.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // "존재하지 않는 여행입니다 (ID: %s)"와 같은 메시지 완성용
  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}

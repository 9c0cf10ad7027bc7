package nik.notes.error.exception;

import nik.notes.error.CommonErrorCode;
import nik.notes.error.exception.base.ServerBaseException;

/**
 * 영속 저장소(관계형 DB) 장애
 *
 * <p>대체 경로가 없는 필수 의존성이므로 호출자에게 그대로 전파됩니다 (HTTP 503).
 */
public class StoreFailureException extends ServerBaseException {

  public StoreFailureException(String operation, Throwable cause) {
    super(CommonErrorCode.STORE_FAILURE, cause, operation);
  }
}

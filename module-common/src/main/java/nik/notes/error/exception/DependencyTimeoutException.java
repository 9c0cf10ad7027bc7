package nik.notes.error.exception;

import nik.notes.error.CommonErrorCode;
import nik.notes.error.exception.base.ServerBaseException;

/** 의존 서비스 호출이 제한 시간을 넘김. Unavailable과 동일하게 처리되며 브레이커 실패로 집계됩니다. */
public class DependencyTimeoutException extends ServerBaseException {

  public DependencyTimeoutException(String operation) {
    super(CommonErrorCode.DEPENDENCY_TIMEOUT, operation);
  }

  public DependencyTimeoutException(String operation, Throwable cause) {
    super(CommonErrorCode.DEPENDENCY_TIMEOUT, cause, operation);
  }
}

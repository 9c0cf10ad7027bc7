package nik.notes.error.exception;

import nik.notes.error.CommonErrorCode;
import nik.notes.error.exception.base.ServerBaseException;

/** 분류되지 않은 내부 오류. 원문 메시지는 로그에만 남고 응답에는 기본 메시지만 노출됩니다. */
public class InternalSystemException extends ServerBaseException {

  private final String taskName;

  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause);
    this.taskName = taskName;
  }

  public String getTaskName() {
    return taskName;
  }
}

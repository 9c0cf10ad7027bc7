package nik.notes.error.exception;

import nik.notes.error.CommonErrorCode;
import nik.notes.error.exception.base.ServerBaseException;

/** 생성 백엔드가 응답했으나 사용할 수 있는 추천 목록이 없음 (빈 응답, 파싱 실패 등) */
public class GenerationFailureException extends ServerBaseException {

  public GenerationFailureException(String reason) {
    super(CommonErrorCode.GENERATION_FAILURE, reason);
  }

  public GenerationFailureException(String reason, Throwable cause) {
    super(CommonErrorCode.GENERATION_FAILURE, cause, reason);
  }
}

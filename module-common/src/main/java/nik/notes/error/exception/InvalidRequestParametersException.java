package nik.notes.error.exception;

import nik.notes.error.CommonErrorCode;
import nik.notes.error.exception.base.ClientBaseException;
import nik.notes.error.exception.marker.CircuitBreakerIgnoreMarker;

/** 추천 요청 파라미터 검증 실패. 캐시나 생성 백엔드에 접근하기 전에 발생합니다. */
public class InvalidRequestParametersException extends ClientBaseException
    implements CircuitBreakerIgnoreMarker {

  public InvalidRequestParametersException(String reason) {
    super(CommonErrorCode.INVALID_REQUEST_PARAMETERS, reason);
  }
}

package nik.notes.global.error;

import lombok.extern.slf4j.Slf4j;
import nik.notes.error.CommonErrorCode;
import nik.notes.error.dto.ErrorResponse;
import nik.notes.error.exception.RateLimitExceededException;
import nik.notes.error.exception.base.BaseException;
import nik.notes.error.exception.base.ServerBaseException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  /** 비즈니스 예외 처리 (동적 메시지 포함). 서버 예외는 원인까지 기록합니다. */
  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
    if (e instanceof ServerBaseException) {
      log.error(
          "Server Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage(), e);
    } else {
      log.warn("Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    }
    return ErrorResponse.toResponseEntity(e);
  }

  @ExceptionHandler(RateLimitExceededException.class)
  protected ResponseEntity<ErrorResponse> handleRateLimitExceeded(RateLimitExceededException e) {
    log.warn("Rate limit exceeded: retry after {}s", e.getRetryAfterSeconds());
    return ResponseEntity.status(e.getErrorCode().getStatus())
        .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()))
        .body(ErrorResponse.from(e));
  }

  /** 본문 JSON 파싱 실패, 경로 변수 타입 불일치 → 400 */
  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  protected ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception e) {
    log.warn("Unreadable request: {}", e.getMessage());
    return ErrorResponse.toResponseEntity(CommonErrorCode.INVALID_REQUEST_PARAMETERS);
  }

  /** 예측하지 못한 시스템 예외. 상세 메시지는 숨기고 공통 코드만 노출합니다. */
  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ErrorResponse> handleException(Exception e) {
    log.error("Unexpected System Failure: ", e);
    return ErrorResponse.toResponseEntity(CommonErrorCode.INTERNAL_SERVER_ERROR);
  }
}

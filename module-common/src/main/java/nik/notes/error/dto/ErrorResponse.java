package nik.notes.error.dto;

import java.time.LocalDateTime;
import nik.notes.error.ErrorCode;
import nik.notes.error.exception.base.BaseException;
import org.springframework.http.ResponseEntity;

public record ErrorResponse(int status, String code, String message, LocalDateTime timestamp) {

  /**
   * BaseException 기반 응답 (동적 메시지 포함)
   *
   * <p>e.getMessage()를 통해 가공된 메시지(예: 어떤 여행이 없는지)를 전달합니다.
   */
  public static ErrorResponse from(BaseException e) {
    ErrorCode errorCode = e.getErrorCode();
    return new ErrorResponse(
        errorCode.getStatusCode(), errorCode.getCode(), e.getMessage(), LocalDateTime.now());
  }

  /**
   * ErrorCode 기반 응답 (정적 메시지)
   *
   * <p>백엔드 원문 에러는 보안상 숨기고 Enum에 정의된 기본 메시지만 노출합니다.
   */
  public static ErrorResponse from(ErrorCode errorCode) {
    return new ErrorResponse(
        errorCode.getStatusCode(),
        errorCode.getCode(),
        errorCode.getMessage(),
        LocalDateTime.now());
  }

  public static ResponseEntity<ErrorResponse> toResponseEntity(BaseException e) {
    return ResponseEntity.status(e.getErrorCode().getStatus()).body(from(e));
  }

  public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
    return ResponseEntity.status(errorCode.getStatus()).body(from(errorCode));
  }
}

package nik.notes.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_REQUEST_PARAMETERS("C001", "잘못된 요청 파라미터입니다: %s", HttpStatus.BAD_REQUEST),
  TRIP_NOT_FOUND("C002", "존재하지 않는 여행입니다 (ID: %s)", HttpStatus.NOT_FOUND),
  RATE_LIMIT_EXCEEDED(
      "C003", "요청 한도를 초과했습니다. %s초 후 다시 시도해주세요.", HttpStatus.TOO_MANY_REQUESTS),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다.", HttpStatus.INTERNAL_SERVER_ERROR),
  DEPENDENCY_UNAVAILABLE("S002", "의존 서비스를 사용할 수 없습니다 (%s)", HttpStatus.SERVICE_UNAVAILABLE),
  DEPENDENCY_TIMEOUT("S003", "의존 서비스 응답 시간 초과 (%s)", HttpStatus.GATEWAY_TIMEOUT),
  GENERATION_FAILURE("S004", "추천 목록 생성 실패 (%s)", HttpStatus.BAD_GATEWAY),
  STORE_FAILURE("S005", "저장소 장애가 발생했습니다 (%s)", HttpStatus.SERVICE_UNAVAILABLE);

  private final String code;
  private final String message;
  private final HttpStatus status;
}

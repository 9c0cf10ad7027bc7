package nik.notes.error.exception.marker;

/**
 * 서킷 브레이커 실패율 집계에서 제외할 예외 표식
 *
 * <p>호출자의 잘못(잘못된 입력, 한도 초과)은 의존 서비스의 건강 상태와 무관하므로 브레이커를 열지 않아야 합니다.
 */
public interface CircuitBreakerIgnoreMarker {}

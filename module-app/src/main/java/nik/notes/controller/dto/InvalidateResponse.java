package nik.notes.controller.dto;

/** 여행별 제안 캐시 무효화 결과 */
public record InvalidateResponse(long tripId, boolean invalidated) {}

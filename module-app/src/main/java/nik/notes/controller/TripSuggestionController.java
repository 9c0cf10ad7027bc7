package nik.notes.controller;

import lombok.RequiredArgsConstructor;
import nik.notes.controller.dto.InvalidateResponse;
import nik.notes.controller.dto.SuggestionResponse;
import nik.notes.global.response.ApiResponse;
import nik.notes.service.suggestion.TripSuggestionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 저장된 여행 기준 제안 API
 *
 * <ul>
 *   <li>POST /api/v1/trips/{tripId}/suggestions/regenerate - 여행 정보로 제안 재생성 (rate limit 별도 규칙)
 *   <li>DELETE /api/v1/trips/{tripId}/suggestions/cache - 여행의 제안 캐시 무효화
 * </ul>
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/trips/{tripId}/suggestions")
public class TripSuggestionController {

  private final TripSuggestionService tripSuggestionService;

  @PostMapping("/regenerate")
  public ResponseEntity<ApiResponse<SuggestionResponse>> regenerate(@PathVariable long tripId) {
    SuggestionResponse response =
        SuggestionResponse.from(tripSuggestionService.regenerate(tripId));
    return ResponseEntity.ok(ApiResponse.success(response));
  }

  @DeleteMapping("/cache")
  public ResponseEntity<ApiResponse<InvalidateResponse>> invalidate(@PathVariable long tripId) {
    boolean invalidated = tripSuggestionService.invalidate(tripId);
    return ResponseEntity.ok(ApiResponse.success(new InvalidateResponse(tripId, invalidated)));
  }
}

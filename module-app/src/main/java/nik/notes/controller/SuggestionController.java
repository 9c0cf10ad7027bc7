package nik.notes.controller;

import lombok.RequiredArgsConstructor;
import nik.notes.controller.dto.CacheStatsResponse;
import nik.notes.controller.dto.SuggestionRequest;
import nik.notes.controller.dto.SuggestionResponse;
import nik.notes.global.response.ApiResponse;
import nik.notes.service.suggestion.SuggestionOrchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 짐 목록 제안 API
 *
 * <ul>
 *   <li>POST /api/v1/suggestions - 파라미터 기반 제안 조회 (캐시 → 생성 → mock)
 *   <li>GET /api/v1/suggestions/cache-stats - 캐시 적중 통계
 * </ul>
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/suggestions")
public class SuggestionController {

  private final SuggestionOrchestrator orchestrator;

  @PostMapping
  public ResponseEntity<ApiResponse<SuggestionResponse>> suggest(
      @RequestBody SuggestionRequest request) {
    SuggestionResponse response =
        SuggestionResponse.from(orchestrator.getSuggestions(request.toParameters()));
    return ResponseEntity.ok(ApiResponse.success(response));
  }

  @GetMapping("/cache-stats")
  public ResponseEntity<ApiResponse<CacheStatsResponse>> cacheStats() {
    CacheStatsResponse response = CacheStatsResponse.from(orchestrator.cacheStats());
    return ResponseEntity.ok(ApiResponse.success(response));
  }
}

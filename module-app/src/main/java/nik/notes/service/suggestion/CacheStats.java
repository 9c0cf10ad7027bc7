package nik.notes.service.suggestion;

import nik.notes.core.domain.model.CapabilityStatus;

/**
 * 제안 캐시 통계 (프로세스 기동 이후 누적)
 *
 * @param hits 캐시 적중 수
 * @param misses 캐시 미스 수 (캐시 우회 포함)
 * @param hitRate 적중률 0.0~1.0, 조회가 없으면 0
 * @param cacheStatus 캐시 저장소 상태
 * @param generationStatus 생성 백엔드 상태
 */
public record CacheStats(
    long hits,
    long misses,
    double hitRate,
    CapabilityStatus cacheStatus,
    CapabilityStatus generationStatus) {

  public static CacheStats of(
      long hits, long misses, CapabilityStatus cacheStatus, CapabilityStatus generationStatus) {
    long total = hits + misses;
    double hitRate = total == 0 ? 0.0 : (double) hits / total;
    return new CacheStats(hits, misses, hitRate, cacheStatus, generationStatus);
  }
}

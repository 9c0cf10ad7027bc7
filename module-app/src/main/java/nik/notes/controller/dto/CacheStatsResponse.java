package nik.notes.controller.dto;

import nik.notes.service.suggestion.CacheStats;

public record CacheStatsResponse(
    long hits, long misses, double hitRate, String cacheStatus, String generationStatus) {

  public static CacheStatsResponse from(CacheStats stats) {
    return new CacheStatsResponse(
        stats.hits(),
        stats.misses(),
        stats.hitRate(),
        stats.cacheStatus().name(),
        stats.generationStatus().name());
  }
}

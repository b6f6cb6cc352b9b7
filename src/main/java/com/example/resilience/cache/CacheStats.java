package com.example.resilience.cache;

import lombok.Builder;
import lombok.Getter;

/**
 * 캐시 통계 스냅샷
 */
@Getter
@Builder
public class CacheStats {

    private final int totalEntries; // 전체 엔트리 수 (만료됐지만 아직 정리되지 않은 엔트리 포함)
    private final int expiredEntries; // 만료된 엔트리 수
    private final int activeEntries; // 유효한 엔트리 수
    private final int maxSize; // 최대 엔트리 수
    private final double usagePercentage; // 사용률 (%)
    private final long hits; // 캐시 적중 횟수
    private final long misses; // 캐시 미스 횟수
    private final long evictions; // LRU 축출 횟수
}

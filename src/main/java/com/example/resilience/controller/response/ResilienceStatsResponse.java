package com.example.resilience.controller.response;

import com.example.resilience.cache.CacheStats;
import com.example.resilience.ratelimiter.model.RateWindowStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * 복원력 계층 전체 통계 응답 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResilienceStatsResponse {
    private CacheStats cache; // 캐시 통계
    private Map<String, RateWindowStats> rateLimiter; // 카테고리별 Rate Limiter 통계
    private Instant lastDailyQuotaReset; // 마지막 일간 쿼터 초기화 시각
    private Instant lastMonthlyQuotaReset; // 마지막 월간 쿼터 초기화 시각
    private LocalDateTime timestamp; // 응답 생성 시간
}

package com.example.resilience.ratelimiter.model;

import lombok.Builder;
import lombok.Getter;

/**
 * 카테고리 단위 Rate Limiter 통계
 */
@Getter
@Builder
public class RateWindowStats {
    private final String category;
    private final int activeUsers; // 윈도우 안에 요청이 남아 있는 유저 수
    private final long totalRecentRequests; // 윈도우 안의 전체 요청 수
    private final int capacity;
    private final long windowSeconds;
}

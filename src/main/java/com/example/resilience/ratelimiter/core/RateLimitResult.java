package com.example.resilience.ratelimiter.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Rate Limiting 결과를 담는 클래스
 * 한도 초과는 예외가 아니라 이 결과의 allowed=false 로 전달됩니다.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public class RateLimitResult {

    private final boolean allowed; // 요청 허용 여부 (true: 허용, false: 거부)
    private final long remainingRequests; // 남은 요청 수
    private final long resetTimeMillis; // 가장 오래된 요청이 윈도우를 벗어나는 시각 (epoch 밀리초)
    private final String category; // 판정에 사용된 카테고리
    private final Long retryAfterSeconds; // 재시도 권장 시간 (초), 허용된 경우 null

    //허용된 요청을 생성하는 정적 메소드
    public static RateLimitResult allowed(long remainingRequests, long resetTimeMillis, String category) {
        return RateLimitResult.builder()
                .allowed(true)
                .remainingRequests(remainingRequests)
                .resetTimeMillis(resetTimeMillis)
                .category(category)
                .retryAfterSeconds(null)
                .build();
    }

    //거부된 요청을 생성하는 정적 메소드
    public static RateLimitResult rejected(long resetTimeMillis, String category, long retryAfterSeconds) {
        return RateLimitResult.builder()
                .allowed(false)
                .remainingRequests(0)
                .resetTimeMillis(resetTimeMillis)
                .category(category)
                .retryAfterSeconds(retryAfterSeconds)
                .build();
    }
}

package com.example.resilience.ratelimiter.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 유저 한 명, 카테고리 하나에 대한 슬라이딩 윈도우 로그 상태
 */
@Getter
@AllArgsConstructor
public class SlidingWindowLogState {
    private final Deque<Long> requestLog; // 요청 타임스탬프 로그 (오래된 순)
    private final int capacity; // 윈도우 내 최대 요청 수
    private final long windowSizeMillis; // 윈도우 크기 (밀리초)

    public static SlidingWindowLogState createSlidingWindowLog(int capacity, long windowSizeSeconds) {
        long windowSizeMillis = windowSizeSeconds * 1000;
        return new SlidingWindowLogState(new ArrayDeque<>(), capacity, windowSizeMillis);
    }
}

package com.example.resilience.ratelimiter.window;

import com.example.resilience.ratelimiter.core.RateLimitResult;
import com.example.resilience.ratelimiter.core.RateLimiter;
import com.example.resilience.ratelimiter.model.RateWindowStats;
import com.example.resilience.ratelimiter.model.SlidingWindowLogState;
import com.example.resilience.util.TimeUtil;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 카테고리 하나에 대한 유저별 슬라이딩 윈도우 로그 Rate Limiter
 *
 * <p>임의의 {@code windowSeconds} 구간 안에서 정확히 {@code capacity}개의 요청만 허용합니다.
 * 유저 상태에 대한 모든 변경은 {@link ConcurrentHashMap#compute}로 키 단위 원자적으로 수행됩니다.
 */
@Slf4j
public class RateWindow implements RateLimiter {

    private final ConcurrentHashMap<Long, SlidingWindowLogState> logs = new ConcurrentHashMap<>();
    private final String category;
    private final int capacity;
    private final long windowSizeSeconds;
    private final Clock clock;

    /**
     * @param category 카테고리 이름
     * @param capacity 윈도우 내 최대 요청 수
     * @param windowSizeSeconds 윈도우 크기 (초)
     * @param clock 시간 소스
     */
    public RateWindow(String category, int capacity, long windowSizeSeconds, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        if (windowSizeSeconds <= 0) {
            throw new IllegalArgumentException("Window size must be positive");
        }

        this.category = Objects.requireNonNull(category, "category");
        this.capacity = capacity;
        this.windowSizeSeconds = windowSizeSeconds;
        this.clock = Objects.requireNonNull(clock, "clock");

        log.info("RateWindow initialized - category: {}, capacity: {}, windowSize: {}s",
                category, capacity, windowSizeSeconds);
    }

    @Override
    public RateLimitResult isAllowed(long userId) {
        long currentTime = clock.millis();
        final RateLimitResult[] result = new RateLimitResult[1];

        logs.compute(userId, (id, existing) -> {
            SlidingWindowLogState logState = existing != null ? existing
                    : SlidingWindowLogState.createSlidingWindowLog(capacity, windowSizeSeconds);

            // 윈도우 밖의 오래된 요청 제거
            cleanupExpiredRequests(logState, currentTime);

            int currentRequestCount = logState.getRequestLog().size();

            if (currentRequestCount >= capacity) {
                long resetTime = calculateResetTime(logState, currentTime);
                long retryAfter = TimeUtil.calculateRetryAfterSeconds(resetTime, currentTime);

                log.warn("Rate limit exceeded for user {} in category {}. Retry after {}s",
                        userId, category, retryAfter);

                result[0] = RateLimitResult.rejected(resetTime, category, retryAfter);
            } else {
                logState.getRequestLog().addLast(currentTime);
                long resetTime = calculateResetTime(logState, currentTime);

                log.debug("Request allowed for user {} in category {}. Count: {}/{}",
                        userId, category, currentRequestCount + 1, capacity);

                result[0] = RateLimitResult.allowed(capacity - (currentRequestCount + 1), resetTime, category);
            }
            return logState;
        });

        return result[0];
    }

    @Override
    public int getRemainingRequests(long userId) {
        long currentTime = clock.millis();
        final int[] used = {0};

        logs.computeIfPresent(userId, (id, logState) -> {
            cleanupExpiredRequests(logState, currentTime);
            used[0] = logState.getRequestLog().size();
            return logState;
        });

        return Math.max(0, capacity - used[0]);
    }

    /**
     * 유저의 제한이 풀리는 시각 (가장 오래된 요청 + 윈도우)
     * 윈도우 안에 요청이 없으면 비어 있습니다.
     */
    public OptionalLong getResetTimeMillis(long userId) {
        long currentTime = clock.millis();
        final Long[] oldest = {null};

        logs.computeIfPresent(userId, (id, logState) -> {
            cleanupExpiredRequests(logState, currentTime);
            oldest[0] = logState.getRequestLog().peekFirst();
            return logState;
        });

        return oldest[0] == null ? OptionalLong.empty()
                : OptionalLong.of(oldest[0] + TimeUtil.secondsToMillis(windowSizeSeconds));
    }

    @Override
    public void reset(long userId) {
        if (logs.remove(userId) != null) {
            log.info("Rate limit reset for user {} in category {}", userId, category);
        }
    }

    @Override
    public int cleanup() {
        long currentTime = clock.millis();
        final int[] removedCount = {0};

        for (Long userId : logs.keySet()) {
            logs.computeIfPresent(userId, (id, logState) -> {
                cleanupExpiredRequests(logState, currentTime);
                if (logState.getRequestLog().isEmpty()) {
                    removedCount[0]++;
                    return null;
                }
                return logState;
            });
        }

        if (removedCount[0] > 0) {
            log.info("Rate limiter cleanup for category {}: removed {} inactive users", category, removedCount[0]);
        }

        return removedCount[0];
    }

    @Override
    public Map<String, Object> getStats(long userId) {
        long currentTime = clock.millis();
        Map<String, Object> stats = new HashMap<>();
        stats.put("category", category);
        stats.put("userId", userId);
        stats.put("limit", capacity);
        stats.put("windowSizeSeconds", windowSizeSeconds);

        SlidingWindowLogState found = logs.computeIfPresent(userId, (id, logState) -> {
            cleanupExpiredRequests(logState, currentTime);

            int currentRequestCount = logState.getRequestLog().size();
            stats.put("currentRequests", currentRequestCount);
            stats.put("remainingRequests", capacity - currentRequestCount);

            if (!logState.getRequestLog().isEmpty()) {
                stats.put("oldestRequestTime", logState.getRequestLog().peekFirst());
                stats.put("oldestRequestTimeFormatted", TimeUtil.formatTimestamp(logState.getRequestLog().peekFirst()));
                stats.put("newestRequestTime", logState.getRequestLog().peekLast());
            }
            return logState;
        });

        if (found == null) {
            stats.put("status", "No log found");
        }

        return stats;
    }

    //카테고리 전체 통계
    public RateWindowStats getWindowStats() {
        long currentTime = clock.millis();
        final int[] activeUsers = {0};
        final long[] totalRequests = {0};

        for (Long userId : logs.keySet()) {
            logs.computeIfPresent(userId, (id, logState) -> {
                cleanupExpiredRequests(logState, currentTime);
                int recent = logState.getRequestLog().size();
                if (recent > 0) {
                    activeUsers[0]++;
                    totalRequests[0] += recent;
                }
                return logState;
            });
        }

        return RateWindowStats.builder()
                .category(category)
                .activeUsers(activeUsers[0])
                .totalRecentRequests(totalRequests[0])
                .capacity(capacity)
                .windowSeconds(windowSizeSeconds)
                .build();
    }

    @Override
    public String getCategory() {
        return category;
    }

    public int getCapacity() {
        return capacity;
    }

    public long getWindowSizeSeconds() {
        return windowSizeSeconds;
    }

    //윈도우 밖의 만료된 요청 제거: (now - window, now] 구간만 남긴다
    private void cleanupExpiredRequests(SlidingWindowLogState logState, long currentTime) {
        long windowStartTime = currentTime - logState.getWindowSizeMillis();

        while (!logState.getRequestLog().isEmpty()
                && logState.getRequestLog().peekFirst() <= windowStartTime) {
            logState.getRequestLog().pollFirst();
        }
    }

    //가장 오래된 요청이 윈도우에서 빠지는 시간
    private long calculateResetTime(SlidingWindowLogState logState, long currentTime) {
        Long oldestRequest = logState.getRequestLog().peekFirst();
        if (oldestRequest == null) {
            return currentTime;
        }
        return oldestRequest + logState.getWindowSizeMillis();
    }
}

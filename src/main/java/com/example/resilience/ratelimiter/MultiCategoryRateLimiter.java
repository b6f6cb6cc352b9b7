package com.example.resilience.ratelimiter;

import com.example.resilience.ratelimiter.core.RateLimitResult;
import com.example.resilience.ratelimiter.model.RateWindowStats;
import com.example.resilience.ratelimiter.window.RateWindow;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 작업 카테고리별로 독립된 RateWindow를 두는 Rate Limiter
 *
 * <p>비용이 크게 다른 작업(가벼운 검색과 무거운 이미지 분석)이 하나의 예산을 공유하지 않도록
 * 카테고리마다 용량과 윈도우를 따로 둡니다. 등록되지 않은 카테고리는 {@value #GENERAL} 윈도우로 처리됩니다.
 */
@Slf4j
public class MultiCategoryRateLimiter {

    public static final String GENERAL = "general";
    public static final String SEARCH = "search";
    public static final String IMAGE_ANALYSIS = "image_analysis";
    public static final String BARCODE = "barcode";

    private final Map<String, RateWindow> limiters;

    public MultiCategoryRateLimiter(Map<String, RateWindow> limiters) {
        if (!limiters.containsKey(GENERAL)) {
            throw new IllegalArgumentException("A '" + GENERAL + "' category is required as fallback");
        }
        this.limiters = Collections.unmodifiableMap(new LinkedHashMap<>(limiters));

        log.info("MultiCategoryRateLimiter initialized with categories: {}", this.limiters.keySet());
    }

    //카테고리에 맞는 윈도우로 허용 여부 판정
    public RateLimitResult isAllowed(long userId, String category) {
        return resolve(category).isAllowed(userId);
    }

    public int getRemainingRequests(long userId, String category) {
        return resolve(category).getRemainingRequests(userId);
    }

    /**
     * 모든 카테고리의 비활성 유저 상태 정리
     *
     * @return 카테고리별 제거된 유저 수
     */
    public Map<String, Integer> cleanup() {
        Map<String, Integer> cleanupStats = new LinkedHashMap<>();
        limiters.forEach((category, limiter) -> cleanupStats.put(category, limiter.cleanup()));
        return cleanupStats;
    }

    //모든 카테고리에서 유저 상태 초기화
    public void resetUser(long userId) {
        limiters.values().forEach(limiter -> limiter.reset(userId));
    }

    //특정 카테고리에서만 유저 상태 초기화 (등록되지 않은 카테고리는 무시)
    public void resetUser(long userId, String category) {
        RateWindow limiter = limiters.get(category);
        if (limiter != null) {
            limiter.reset(userId);
        }
    }

    public Map<String, RateWindowStats> getStats() {
        Map<String, RateWindowStats> stats = new LinkedHashMap<>();
        limiters.forEach((category, limiter) -> stats.put(category, limiter.getWindowStats()));
        return stats;
    }

    public Set<String> getCategories() {
        return limiters.keySet();
    }

    //카테고리 이름을 실제 윈도우로 변환
    public RateWindow resolve(String category) {
        RateWindow limiter = category != null ? limiters.get(category) : null;
        if (limiter == null) {
            log.debug("Unknown category '{}', falling back to '{}'", category, GENERAL);
            return limiters.get(GENERAL);
        }
        return limiter;
    }
}

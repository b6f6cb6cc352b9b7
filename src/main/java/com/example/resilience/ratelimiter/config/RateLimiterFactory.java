package com.example.resilience.ratelimiter.config;

import com.example.resilience.ratelimiter.MultiCategoryRateLimiter;
import com.example.resilience.ratelimiter.window.RateWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 설정으로부터 카테고리별 RateWindow와 MultiCategoryRateLimiter를 생성하는 팩토리 클래스
 */
@Slf4j
@RequiredArgsConstructor
public class RateLimiterFactory {

    private final RateLimiterProperties properties;
    private final Clock clock;

    //설정된 모든 카테고리로 MultiCategoryRateLimiter 생성
    public MultiCategoryRateLimiter createMultiCategoryRateLimiter() {
        Map<String, RateLimiterProperties.WindowConfig> configured = properties.getCategories();
        Map<String, RateWindow> windows = new LinkedHashMap<>();

        configured.forEach((category, config) -> windows.put(category, createRateWindow(category, config)));

        // general 카테고리가 빠진 설정이면 기본값으로 보충
        if (!windows.containsKey(MultiCategoryRateLimiter.GENERAL)) {
            RateLimiterProperties.WindowConfig fallback =
                    RateLimiterProperties.defaultCategories().get(MultiCategoryRateLimiter.GENERAL);
            log.warn("No '{}' category configured, using default capacity: {}, windowSize: {}s",
                    MultiCategoryRateLimiter.GENERAL, fallback.getCapacity(), fallback.getWindowSeconds());
            windows.put(MultiCategoryRateLimiter.GENERAL, createRateWindow(MultiCategoryRateLimiter.GENERAL, fallback));
        }

        return new MultiCategoryRateLimiter(windows);
    }

    //카테고리 하나에 대한 RateWindow 생성
    public RateWindow createRateWindow(String category, RateLimiterProperties.WindowConfig config) {
        log.info("Creating RateWindow for category '{}' with capacity: {}, windowSize: {}s",
                category, config.getCapacity(), config.getWindowSeconds());

        return new RateWindow(category, config.getCapacity(), config.getWindowSeconds(), clock);
    }
}

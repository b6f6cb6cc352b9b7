package com.example.resilience.scheduler;

import com.example.resilience.cache.CacheStore;
import com.example.resilience.quota.QuotaTracker;
import com.example.resilience.ratelimiter.MultiCategoryRateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 캐시 만료 정리, Rate Limiter 비활성 유저 정리, 쿼터 초기화를 주기적으로 실행하는 작업
 * 각 컴포넌트는 스스로 정리하지 않으므로 이 작업이 유일한 호출 지점입니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResilienceMaintenanceJob {

    private final CacheStore<Object> cacheStore;
    private final MultiCategoryRateLimiter multiCategoryRateLimiter;
    private final QuotaTracker quotaTracker;

    @Scheduled(fixedDelayString = "${resilience.maintenance.cache-cleanup-interval-ms:300000}",
            initialDelayString = "${resilience.maintenance.cache-cleanup-interval-ms:300000}")
    public void cleanupExpiredCache() {
        int removed = cacheStore.cleanupExpired();
        log.debug("Cache cleanup finished: {} expired entries removed", removed);
    }

    @Scheduled(fixedDelayString = "${resilience.maintenance.rate-limiter-cleanup-interval-ms:300000}",
            initialDelayString = "${resilience.maintenance.rate-limiter-cleanup-interval-ms:300000}")
    public void cleanupRateLimiters() {
        Map<String, Integer> removed = multiCategoryRateLimiter.cleanup();
        log.debug("Rate limiter cleanup finished: {}", removed);
    }

    @Scheduled(cron = "${resilience.maintenance.daily-reset-cron:0 0 0 * * *}",
            zone = "${resilience.maintenance.zone:UTC}")
    public void resetDailyQuotas() {
        quotaTracker.resetDaily();
    }

    @Scheduled(cron = "${resilience.maintenance.monthly-reset-cron:0 0 0 1 * *}",
            zone = "${resilience.maintenance.zone:UTC}")
    public void resetMonthlyQuotas() {
        quotaTracker.resetMonthly();
    }
}

package com.example.resilience.controller;

import com.example.resilience.cache.CacheStore;
import com.example.resilience.controller.request.AdminStatsRequest;
import com.example.resilience.controller.response.AdminResetResponse;
import com.example.resilience.controller.response.AdminStatsResponse;
import com.example.resilience.controller.response.ResilienceStatsResponse;
import com.example.resilience.quota.QuotaTracker;
import com.example.resilience.ratelimiter.MultiCategoryRateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 복원력 계층 관리용 컨트롤러
 * 통계 조회, 유저별 Rate Limit 초기화, 캐시 정리를 제공합니다.
 */
@Slf4j
@RestController
@RequestMapping("/admin/resilience")
@RequiredArgsConstructor
public class ResilienceAdminController {

    private final CacheStore<Object> cacheStore;
    private final MultiCategoryRateLimiter multiCategoryRateLimiter;
    private final QuotaTracker quotaTracker;
    private final Clock clock;

    //전체 통계 조회
    @GetMapping("/stats")
    public ResponseEntity<ResilienceStatsResponse> getStats() {
        ResilienceStatsResponse response = ResilienceStatsResponse.builder()
                .cache(cacheStore.getStats())
                .rateLimiter(multiCategoryRateLimiter.getStats())
                .lastDailyQuotaReset(quotaTracker.getLastDailyReset())
                .lastMonthlyQuotaReset(quotaTracker.getLastMonthlyReset())
                .timestamp(LocalDateTime.now(clock))
                .build();

        return ResponseEntity.ok(response);
    }

    //유저 통계 조회 (카테고리 윈도우 상태 + 쿼터 사용량)
    @PostMapping("/users/stats")
    public ResponseEntity<AdminStatsResponse> getUserStats(@Valid @RequestBody AdminStatsRequest request) {
        long userId = request.getUserId();

        Map<String, Integer> remaining = new LinkedHashMap<>();
        for (String category : multiCategoryRateLimiter.getCategories()) {
            remaining.put(category, multiCategoryRateLimiter.getRemainingRequests(userId, category));
        }

        AdminStatsResponse response = AdminStatsResponse.builder()
                .userId(userId)
                .category(request.getCategory())
                .stats(multiCategoryRateLimiter.resolve(request.getCategory()).getStats(userId))
                .remainingByCategory(remaining)
                .quotaUsage(quotaTracker.getUsage(userId))
                .timestamp(LocalDateTime.now(clock))
                .build();

        log.info("Resilience stats requested for user: {}, category: {}", userId, request.getCategory());
        return ResponseEntity.ok(response);
    }

    //유저 Rate Limit 초기화 (category 미지정 시 모든 카테고리)
    @PostMapping("/users/{userId}/reset")
    public ResponseEntity<AdminResetResponse> resetUser(@PathVariable("userId") long userId,
                                                        @RequestParam(name = "category", required = false) String category) {
        Map<String, String> resetResults = new LinkedHashMap<>();

        if (category == null) {
            multiCategoryRateLimiter.resetUser(userId);
            multiCategoryRateLimiter.getCategories().forEach(name -> resetResults.put(name, "reset"));
        } else if (multiCategoryRateLimiter.getCategories().contains(category)) {
            multiCategoryRateLimiter.resetUser(userId, category);
            resetResults.put(category, "reset");
        } else {
            resetResults.put(category, "unknown category");
        }

        AdminResetResponse response = AdminResetResponse.builder()
                .message("Rate limit state reset")
                .userId(userId)
                .resetResults(resetResults)
                .timestamp(LocalDateTime.now(clock))
                .build();

        log.info("Rate limit reset requested for user: {}, results: {}", userId, resetResults);
        return ResponseEntity.ok(response);
    }

    //만료된 캐시 엔트리 즉시 정리
    @PostMapping("/cache/cleanup")
    public ResponseEntity<Map<String, Integer>> cleanupCache() {
        int removed = cacheStore.cleanupExpired();
        return ResponseEntity.ok(Map.of("removed", removed));
    }

    //캐시 전체 비우기
    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        cacheStore.clear();
        return ResponseEntity.noContent().build();
    }
}

package com.example.resilience.quota;

import com.example.resilience.support.MutableClock;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@DisplayName("QuotaTracker 테스트")
class QuotaTrackerTest {

    private MutableClock clock;
    private QuotaTracker quotaTracker;
    private final long testUserId = 11L;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(1_700_000_000_000L);
        quotaTracker = new QuotaTracker(Map.of("image_analysis", 2L), Map.of("image_analysis", 3L), clock);
    }

    @Test
    @DisplayName("일간 한도에 도달하면 일간 사유로 거부되어야 함")
    void testDailyLimit() {
        assertTrue(quotaTracker.checkQuota(testUserId, "image_analysis").isAllowed());
        quotaTracker.useQuota(testUserId, "image_analysis");
        quotaTracker.useQuota(testUserId, "image_analysis");

        QuotaCheckResult result = quotaTracker.checkQuota(testUserId, "image_analysis");

        assertFalse(result.isAllowed());
        assertEquals("daily limit of 2 exceeded", result.getReason());
    }

    @Test
    @DisplayName("일간 초기화 후에도 월간 한도는 유지되어야 함")
    void testMonthlyLimitSurvivesDailyReset() {
        quotaTracker.useQuota(testUserId, "image_analysis");
        quotaTracker.useQuota(testUserId, "image_analysis");
        quotaTracker.resetDaily();
        quotaTracker.useQuota(testUserId, "image_analysis");

        QuotaCheckResult result = quotaTracker.checkQuota(testUserId, "image_analysis");

        assertFalse(result.isAllowed());
        assertEquals("monthly limit of 3 exceeded", result.getReason());

        quotaTracker.resetMonthly();
        assertTrue(quotaTracker.checkQuota(testUserId, "image_analysis").isAllowed());
    }

    @Test
    @DisplayName("한도가 설정되지 않은 작업은 제한이 없어야 함")
    void testUnlimitedOperation() {
        for (int i = 0; i < 1000; i++) {
            quotaTracker.useQuota(testUserId, "searches");
        }

        QuotaCheckResult result = quotaTracker.checkQuota(testUserId, "searches");
        assertTrue(result.isAllowed());
        assertEquals("quota available", result.getReason());
    }

    @Test
    @DisplayName("사용량 스냅샷과 유저 격리")
    void testUsageSnapshot() {
        quotaTracker.useQuota(testUserId, "image_analysis");
        quotaTracker.useQuota(testUserId, "searches");
        quotaTracker.useQuota(testUserId, "searches");

        QuotaUsage usage = quotaTracker.getUsage(testUserId);
        assertEquals(testUserId, usage.getUserId());
        assertEquals(1L, usage.getDaily().get("image_analysis"));
        assertEquals(2L, usage.getMonthly().get("searches"));

        assertTrue(quotaTracker.getUsage(99L).getDaily().isEmpty(), "다른 유저의 사용량은 비어 있어야 합니다");
        assertTrue(quotaTracker.checkQuota(99L, "image_analysis").isAllowed());
    }

    @Test
    @DisplayName("초기화 시각이 기록되어야 함")
    void testResetTimestamps() {
        Instant created = quotaTracker.getLastDailyReset();
        clock.advance(Duration.ofHours(24));

        quotaTracker.resetDaily();

        assertEquals(created.plus(Duration.ofHours(24)), quotaTracker.getLastDailyReset());
        assertEquals(created, quotaTracker.getLastMonthlyReset());
    }

    @Test
    @DisplayName("동시 사용량 증가가 유실되지 않아야 함")
    void testConcurrentUse() throws Exception {
        QuotaTracker tracker = new QuotaTracker(Map.of(), Map.of(), clock);
        int threads = 8;
        int perThread = 500;

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        tracker.useQuota(testUserId, "barcode_scans");
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals((long) threads * perThread, tracker.getUsage(testUserId).getDaily().get("barcode_scans"));
    }
}

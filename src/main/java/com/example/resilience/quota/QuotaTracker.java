package com.example.resilience.quota;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 유저별, 작업별 일간/월간 사용량 추적기
 *
 * <p>사용량은 실제로 작업이 실행된 뒤 {@link #useQuota}로만 증가하므로 거부된 시도는 쿼터를 소모하지 않습니다.
 * 날짜/월 경계는 알지 못하며, 초기화는 외부 스케줄러가 {@link #resetDaily()}/{@link #resetMonthly()}를 호출해 수행합니다.
 */
@Slf4j
public class QuotaTracker {

    private final Map<String, Long> dailyLimits;
    private final Map<String, Long> monthlyLimits;
    private final Clock clock;

    private final ConcurrentHashMap<Long, ConcurrentHashMap<String, AtomicLong>> dailyUsage = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, ConcurrentHashMap<String, AtomicLong>> monthlyUsage = new ConcurrentHashMap<>();

    private volatile Instant lastDailyReset;
    private volatile Instant lastMonthlyReset;

    public QuotaTracker(Map<String, Long> dailyLimits, Map<String, Long> monthlyLimits, Clock clock) {
        this.dailyLimits = Map.copyOf(dailyLimits);
        this.monthlyLimits = Map.copyOf(monthlyLimits);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lastDailyReset = clock.instant();
        this.lastMonthlyReset = clock.instant();

        log.info("QuotaTracker initialized - daily: {}, monthly: {}", this.dailyLimits, this.monthlyLimits);
    }

    /**
     * 쿼터 여유 확인 (일간 한도를 먼저 확인)
     */
    public QuotaCheckResult checkQuota(long userId, String operation) {
        long dailyUsed = currentCount(dailyUsage, userId, operation);
        long dailyLimit = dailyLimits.getOrDefault(operation, Long.MAX_VALUE);

        if (dailyUsed >= dailyLimit) {
            log.debug("Daily quota exhausted - user: {}, operation: {}, used: {}/{}",
                    userId, operation, dailyUsed, dailyLimit);
            return QuotaCheckResult.dailyExceeded(dailyLimit);
        }

        long monthlyUsed = currentCount(monthlyUsage, userId, operation);
        long monthlyLimit = monthlyLimits.getOrDefault(operation, Long.MAX_VALUE);

        if (monthlyUsed >= monthlyLimit) {
            log.debug("Monthly quota exhausted - user: {}, operation: {}, used: {}/{}",
                    userId, operation, monthlyUsed, monthlyLimit);
            return QuotaCheckResult.monthlyExceeded(monthlyLimit);
        }

        return QuotaCheckResult.available();
    }

    //작업 실행이 확인된 뒤에만 호출
    public void useQuota(long userId, String operation) {
        increment(dailyUsage, userId, operation);
        increment(monthlyUsage, userId, operation);
    }

    public QuotaUsage getUsage(long userId) {
        return new QuotaUsage(userId, snapshot(dailyUsage, userId), snapshot(monthlyUsage, userId));
    }

    //모든 유저의 일간 사용량 초기화 (스케줄러가 호출)
    public void resetDaily() {
        dailyUsage.clear();
        lastDailyReset = clock.instant();
        log.info("Daily quotas reset");
    }

    //모든 유저의 월간 사용량 초기화 (스케줄러가 호출)
    public void resetMonthly() {
        monthlyUsage.clear();
        lastMonthlyReset = clock.instant();
        log.info("Monthly quotas reset");
    }

    public Instant getLastDailyReset() {
        return lastDailyReset;
    }

    public Instant getLastMonthlyReset() {
        return lastMonthlyReset;
    }

    private static long currentCount(ConcurrentHashMap<Long, ConcurrentHashMap<String, AtomicLong>> usage,
                                     long userId, String operation) {
        ConcurrentHashMap<String, AtomicLong> perOperation = usage.get(userId);
        if (perOperation == null) {
            return 0;
        }
        AtomicLong counter = perOperation.get(operation);
        return counter != null ? counter.get() : 0;
    }

    private static void increment(ConcurrentHashMap<Long, ConcurrentHashMap<String, AtomicLong>> usage,
                                  long userId, String operation) {
        usage.computeIfAbsent(userId, id -> new ConcurrentHashMap<>())
                .computeIfAbsent(operation, op -> new AtomicLong())
                .incrementAndGet();
    }

    private static Map<String, Long> snapshot(ConcurrentHashMap<Long, ConcurrentHashMap<String, AtomicLong>> usage,
                                              long userId) {
        ConcurrentHashMap<String, AtomicLong> perOperation = usage.get(userId);
        if (perOperation == null) {
            return Collections.emptyMap();
        }
        Map<String, Long> copy = new TreeMap<>();
        perOperation.forEach((operation, counter) -> copy.put(operation, counter.get()));
        return copy;
    }
}

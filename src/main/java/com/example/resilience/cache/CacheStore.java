package com.example.resilience.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * TTL 만료와 LRU 축출을 지원하는 인메모리 캐시
 *
 * <p>용량 확인 → 축출 → 삽입이 여러 단계에 걸치므로 모든 연산은 저장소 단위의 단일 락 안에서 수행됩니다.
 * 락 구간 안에서는 I/O가 일어나지 않습니다.
 *
 * <p>프로세스가 재시작되면 모든 엔트리가 사라지므로 호출자는 캐시 부재를 오류로 취급하지 않아야 합니다.
 *
 * @param <V> 값 타입
 */
@Slf4j
public class CacheStore<V> {

    private final Map<String, CacheEntry<V>> entries = new HashMap<>();
    // 삽입 순서가 곧 최근 접근 순서 (접근 시 꼬리로 이동)
    private final LinkedHashMap<String, Long> accessTimes = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private final Clock clock;
    private final int maxSize;
    private final Duration defaultTtl;

    private long hits;
    private long misses;
    private long evictions;

    /**
     * @param maxSize 최대 엔트리 수
     * @param defaultTtl TTL을 지정하지 않은 set 호출에 적용할 기본 TTL
     * @param clock 시간 소스
     */
    public CacheStore(int maxSize, Duration defaultTtl, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Max size must be positive");
        }
        if (defaultTtl == null || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("Default TTL must not be negative");
        }

        this.maxSize = maxSize;
        this.defaultTtl = defaultTtl;
        this.clock = Objects.requireNonNull(clock, "clock");

        log.info("CacheStore initialized - maxSize: {}, defaultTtl: {}s", maxSize, defaultTtl.toSeconds());
    }

    /**
     * 키에 해당하는 값을 조회합니다.
     * 만료된 엔트리는 조회 시점에 제거되고 부재로 취급됩니다.
     */
    public Optional<V> get(String key) {
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }

            long now = clock.millis();
            if (entry.isExpired(now)) {
                removeInternal(key);
                misses++;
                log.debug("Cache entry expired on read - key: {}", key);
                return Optional.empty();
            }

            touch(key, now);
            hits++;
            log.debug("Cache hit for key: {}", key);
            return Optional.of(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    //기본 TTL로 저장
    public void set(String key, V value) {
        set(key, value, null);
    }

    /**
     * 값을 저장합니다.
     * 새 키이고 저장소가 가득 찬 경우 LRU 엔트리를 먼저 축출합니다. 기존 키 덮어쓰기는 축출을 일으키지 않습니다.
     *
     * @param ttl 만료 시간 (null이면 기본 TTL)
     */
    public void set(String key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;

        lock.lock();
        try {
            long now = clock.millis();
            CacheEntry<V> entry = new CacheEntry<>(key, value, now, effectiveTtl.toMillis());

            if (!entries.containsKey(key) && entries.size() >= maxSize) {
                evictLeastRecentlyUsed();
            }

            entries.put(key, entry);
            touch(key, now);

            log.debug("Cache set for key: {}, TTL: {}s", key, effectiveTtl.toSeconds());
        } finally {
            lock.unlock();
        }
    }

    //엔트리 삭제, 존재했으면 true
    public boolean delete(String key) {
        lock.lock();
        try {
            if (entries.containsKey(key)) {
                removeInternal(key);
                log.debug("Cache deleted for key: {}", key);
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 만료된 엔트리를 모두 제거합니다.
     * 매 연산마다가 아니라 외부 스케줄러가 주기적으로 호출하는 용도입니다.
     *
     * @return 제거된 엔트리 수
     */
    public int cleanupExpired() {
        lock.lock();
        try {
            long now = clock.millis();
            List<String> expiredKeys = new ArrayList<>();

            for (CacheEntry<V> entry : entries.values()) {
                if (entry.isExpired(now)) {
                    expiredKeys.add(entry.getKey());
                }
            }

            for (String key : expiredKeys) {
                removeInternal(key);
            }

            if (!expiredKeys.isEmpty()) {
                log.info("Cleaned up {} expired cache entries", expiredKeys.size());
            }

            return expiredKeys.size();
        } finally {
            lock.unlock();
        }
    }

    //모든 엔트리 제거
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            accessTimes.clear();
            log.info("Cache cleared");
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public CacheStats getStats() {
        lock.lock();
        try {
            long now = clock.millis();
            int expired = (int) entries.values().stream()
                    .filter(entry -> entry.isExpired(now))
                    .count();

            return CacheStats.builder()
                    .totalEntries(entries.size())
                    .expiredEntries(expired)
                    .activeEntries(entries.size() - expired)
                    .maxSize(maxSize)
                    .usagePercentage(entries.size() * 100.0 / maxSize)
                    .hits(hits)
                    .misses(misses)
                    .evictions(evictions)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    // 락을 잡은 상태에서만 호출
    private void evictLeastRecentlyUsed() {
        String lruKey = null;
        long oldest = Long.MAX_VALUE;

        // 접근 시각이 같으면 먼저 접근된(앞쪽) 키가 선택된다
        for (Map.Entry<String, Long> candidate : accessTimes.entrySet()) {
            if (candidate.getValue() < oldest) {
                oldest = candidate.getValue();
                lruKey = candidate.getKey();
            }
        }

        if (lruKey == null) {
            return;
        }

        removeInternal(lruKey);
        evictions++;
        log.debug("Evicted LRU cache entry: {}", lruKey);
    }

    private void touch(String key, long now) {
        accessTimes.remove(key);
        accessTimes.put(key, now);
    }

    private void removeInternal(String key) {
        entries.remove(key);
        accessTimes.remove(key);
    }
}

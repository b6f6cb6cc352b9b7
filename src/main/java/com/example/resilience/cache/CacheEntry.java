package com.example.resilience.cache;

import lombok.Getter;

/**
 * 캐시에 저장되는 불변 엔트리
 * 값 갱신은 새 엔트리로 교체하는 방식으로만 이루어집니다.
 *
 * @param <V> 값 타입
 */
@Getter
public final class CacheEntry<V> {

    private final String key; // 캐시 키
    private final V value; // 저장된 값
    private final long createdAtMillis; // 생성 시각 (epoch 밀리초)
    private final long expiresAtMillis; // 만료 시각 (epoch 밀리초)

    public CacheEntry(String key, V value, long createdAtMillis, long ttlMillis) {
        if (ttlMillis < 0) {
            throw new IllegalArgumentException("TTL must not be negative");
        }
        this.key = key;
        this.value = value;
        this.createdAtMillis = createdAtMillis;
        this.expiresAtMillis = createdAtMillis + ttlMillis;
    }

    //만료 여부 (만료 시각과 같아지는 순간부터 만료)
    public boolean isExpired(long nowMillis) {
        return expiresAtMillis <= nowMillis;
    }
}

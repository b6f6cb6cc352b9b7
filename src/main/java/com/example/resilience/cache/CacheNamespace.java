package com.example.resilience.cache;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * 공유 CacheStore 위의 접두사 기반 뷰
 * 상품 조회 결과, 세션, 이미지 분석 결과처럼 종류별로 키 공간과 기본 TTL을 나눌 때 사용합니다.
 *
 * @param <V> 값 타입
 */
public class CacheNamespace<V> {

    private final CacheStore<? super V> cacheStore;
    private final CacheKeyGenerator keyGenerator;
    private final String prefix;
    private final Class<V> valueType;
    private final Duration defaultTtl;

    public CacheNamespace(CacheStore<? super V> cacheStore, CacheKeyGenerator keyGenerator,
                          String prefix, Class<V> valueType, Duration defaultTtl) {
        this.cacheStore = Objects.requireNonNull(cacheStore, "cacheStore");
        this.keyGenerator = Objects.requireNonNull(keyGenerator, "keyGenerator");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
        this.defaultTtl = defaultTtl;
    }

    //값 타입이 다른 엔트리는 없는 것으로 취급
    public Optional<V> get(String key) {
        return cacheStore.get(qualify(key))
                .filter(valueType::isInstance)
                .map(valueType::cast);
    }

    //네임스페이스 기본 TTL로 저장 (기본 TTL이 없으면 저장소 기본값)
    public void set(String key, V value) {
        cacheStore.set(qualify(key), value, defaultTtl);
    }

    public void set(String key, V value, Duration ttl) {
        cacheStore.set(qualify(key), value, ttl);
    }

    public boolean delete(String key) {
        return cacheStore.delete(qualify(key));
    }

    //바이너리 내용의 해시를 키로 조회
    public Optional<V> getByContent(byte[] content) {
        return get(keyGenerator.contentHash(content));
    }

    public void setByContent(byte[] content, V value) {
        set(keyGenerator.contentHash(content), value);
    }

    public String qualify(String key) {
        return prefix + key;
    }

    public String getPrefix() {
        return prefix;
    }
}

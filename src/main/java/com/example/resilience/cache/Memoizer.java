package com.example.resilience.cache;

import com.example.resilience.operation.AsyncFunction;
import com.example.resilience.operation.AsyncOperation;
import com.example.resilience.operation.AsyncOperations;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * CacheStore 위에서 동작하는 비동기 호출 메모이저
 *
 * <p>캐시 적중 시 원래 호출을 건너뛰고, 미스 시 호출이 성공하면 결과를 TTL과 함께 저장합니다.
 * 실패한 호출은 캐시하지 않으며 예외는 감싸지 않고 그대로 전파됩니다. {@code null} 결과는 반환만 하고 저장하지 않습니다.
 *
 * <p>동일 키에 대한 동시 미스를 하나로 합치지 않습니다. 두 호출이 모두 원래 함수를 실행하고 같은 슬롯에 결과를 씁니다.
 */
@Slf4j
public class Memoizer {

    private final CacheStore<Object> cacheStore;
    private final CacheKeyGenerator keyGenerator;

    public Memoizer(CacheStore<Object> cacheStore, CacheKeyGenerator keyGenerator) {
        this.cacheStore = Objects.requireNonNull(cacheStore, "cacheStore");
        this.keyGenerator = Objects.requireNonNull(keyGenerator, "keyGenerator");
    }

    /**
     * 메모이즈된 호출 실행
     *
     * @param functionName 키 생성에 쓰이는 함수 식별자
     * @param resultType 결과 타입 (이 타입이 아닌 캐시 값은 미스로 취급)
     * @param ttl 결과 보관 시간 (null이면 저장소 기본 TTL)
     * @param arguments 키 생성에 쓰이는 호출 인자
     * @param operation 미스 시 실행할 실제 호출
     * @return 캐시 값, 호출 결과 또는 호출의 원래 예외로 완료되는 future
     */
    public <T> CompletableFuture<T> invoke(String functionName, Class<T> resultType, Duration ttl,
                                           CallArguments arguments, AsyncOperation<T> operation) {
        validateTtl(ttl);
        String cacheKey = keyGenerator.generate(functionName, arguments);

        Optional<T> cached = cacheStore.get(cacheKey)
                .filter(resultType::isInstance)
                .map(resultType::cast);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get());
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        AsyncOperations.start(operation).whenComplete((value, error) -> {
            if (error != null) {
                log.error("Error in cached function {}: {}", functionName, error.getMessage());
                result.completeExceptionally(error);
                return;
            }
            if (value != null) {
                cacheStore.set(cacheKey, value, ttl);
            }
            result.complete(value);
        });
        return result;
    }

    //단일 인자 함수를 메모이즈된 함수로 감싼다
    public <A, T> AsyncFunction<A, T> memoize(String functionName, Class<T> resultType, Duration ttl,
                                              AsyncFunction<A, T> function) {
        validateTtl(ttl);
        return argument -> invoke(functionName, resultType, ttl, CallArguments.of(argument), function.bind(argument));
    }

    //인자 없는 호출을 메모이즈된 호출로 감싼다
    public <T> AsyncOperation<T> memoizeOperation(String functionName, Class<T> resultType, Duration ttl,
                                                  AsyncOperation<T> operation) {
        validateTtl(ttl);
        return () -> invoke(functionName, resultType, ttl, CallArguments.empty(), operation);
    }

    public CacheStore<Object> getCacheStore() {
        return cacheStore;
    }

    public CacheKeyGenerator getKeyGenerator() {
        return keyGenerator;
    }

    private static void validateTtl(Duration ttl) {
        if (ttl != null && ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must not be negative");
        }
    }
}

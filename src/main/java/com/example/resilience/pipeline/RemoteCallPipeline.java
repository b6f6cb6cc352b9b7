package com.example.resilience.pipeline;

import com.example.resilience.cache.Memoizer;
import com.example.resilience.operation.AsyncFunction;
import com.example.resilience.operation.AsyncOperation;
import com.example.resilience.retry.RetryExecutor;
import com.example.resilience.retry.RetryPolicy;
import lombok.RequiredArgsConstructor;

import java.time.Duration;

/**
 * 원격 호출 지점에 캐시와 재시도를 일관되게 적용하는 조합기
 *
 * <p>조회성 호출은 memoize(retry(호출)) 형태로, 쓰기성 호출(저장소 기록 등)은 retry(호출) 형태로 감쌉니다.
 * 캐시 미스일 때만 원격 호출과 재시도가 일어납니다.
 */
@RequiredArgsConstructor
public class RemoteCallPipeline {

    private final Memoizer memoizer;
    private final RetryExecutor retryExecutor;

    //결과를 캐시하는 조회 호출
    public <A, T> AsyncFunction<A, T> cachedRemoteCall(String name, Class<T> resultType, Duration ttl,
                                                     AsyncFunction<A, T> remote) {
        return memoizer.memoize(name, resultType, ttl, retryExecutor.wrapFunction(name, remote));
    }

    //호출 지점별로 재시도 정책을 달리하는 조회 호출
    public <A, T> AsyncFunction<A, T> cachedRemoteCall(String name, Class<T> resultType, Duration ttl,
                                                     RetryPolicy policy, AsyncFunction<A, T> remote) {
        return memoizer.memoize(name, resultType, ttl, retryExecutor.withPolicy(policy).wrapFunction(name, remote));
    }

    //캐시 없이 재시도만 적용하는 호출
    public <T> AsyncOperation<T> remoteCall(String name, AsyncOperation<T> remote) {
        return retryExecutor.wrap(name, remote);
    }

    public <T> AsyncOperation<T> remoteCall(String name, RetryPolicy policy, AsyncOperation<T> remote) {
        return retryExecutor.withPolicy(policy).wrap(name, remote);
    }
}

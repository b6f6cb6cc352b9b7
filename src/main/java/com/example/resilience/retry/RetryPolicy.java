package com.example.resilience.retry;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 재시도 정책: 최대 재시도 횟수와 지수 백오프의 기준 지연
 * 총 시도 횟수는 {@code maxRetries + 1} 입니다.
 */
@Getter
@ToString
public final class RetryPolicy {

    public static final int MAX_RETRIES_LIMIT = 10;
    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final int maxRetries; // 첫 시도 이후 최대 재시도 횟수
    private final Duration baseDelay; // 첫 재시도 전 대기 시간

    public RetryPolicy(int maxRetries, Duration baseDelay) {
        if (maxRetries < 0 || maxRetries > MAX_RETRIES_LIMIT) {
            throw new IllegalArgumentException("Max retries must be between 0 and " + MAX_RETRIES_LIMIT);
        }
        // 1ms 미만의 대기는 resilience4j에서 "재시도 없음"으로 해석된다
        if (baseDelay == null || baseDelay.toMillis() < 1) {
            throw new IllegalArgumentException("Base delay must be at least 1ms");
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
    }

    public static RetryPolicy of(int maxRetries, Duration baseDelay) {
        return new RetryPolicy(maxRetries, baseDelay);
    }

    //n번째(1부터) 재시도 전 대기 시간(ms): baseDelay × 2^(n-1)
    public IntervalFunction intervalFunction() {
        return IntervalFunction.ofExponentialBackoff(baseDelay.toMillis(), BACKOFF_MULTIPLIER);
    }

    /**
     * resilience4j 재시도 설정으로 변환
     * 모든 예외를 재시도 대상으로 삼고, 최대 시도 횟수는 {@code maxRetries + 1} 입니다.
     */
    public RetryConfig toRetryConfig() {
        return RetryConfig.custom()
                .maxAttempts(maxRetries + 1)
                .intervalFunction(intervalFunction())
                .retryExceptions(Throwable.class)
                .build();
    }

    //attempt번째(0부터) 실패 후 대기 시간
    public Duration delayForAttempt(int attempt) {
        return Duration.ofMillis(intervalFunction().apply(attempt + 1));
    }

    //모든 재시도가 실패할 때 누적되는 최대 대기 시간
    public Duration worstCaseDelay() {
        Duration total = Duration.ZERO;
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            total = total.plus(delayForAttempt(attempt));
        }
        return total;
    }
}

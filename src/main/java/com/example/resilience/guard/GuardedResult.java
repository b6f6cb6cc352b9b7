package com.example.resilience.guard;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * RequestGuard 실행 결과
 * 한도 초과는 예외가 아니라 상태 값으로 전달됩니다.
 *
 * @param <T> 작업 결과 타입
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GuardedResult<T> {

    private final GuardStatus status;
    private final T value; // COMPLETED 인 경우의 작업 결과
    private final Long retryAfterSeconds; // RATE_LIMITED 인 경우의 재시도 권장 시간
    private final String message; // 거부 사유 또는 사용자에게 보여줄 안내 문구

    public static <T> GuardedResult<T> completed(T value) {
        return new GuardedResult<>(GuardStatus.COMPLETED, value, null, null);
    }

    public static <T> GuardedResult<T> rateLimited(long retryAfterSeconds, String message) {
        return new GuardedResult<>(GuardStatus.RATE_LIMITED, null, retryAfterSeconds, message);
    }

    public static <T> GuardedResult<T> quotaExceeded(String reason) {
        return new GuardedResult<>(GuardStatus.QUOTA_EXCEEDED, null, null, reason);
    }

    public boolean isCompleted() {
        return status == GuardStatus.COMPLETED;
    }
}

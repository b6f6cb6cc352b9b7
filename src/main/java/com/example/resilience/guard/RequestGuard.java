package com.example.resilience.guard;

import com.example.resilience.operation.AsyncOperation;
import com.example.resilience.operation.AsyncOperations;
import com.example.resilience.quota.QuotaCheckResult;
import com.example.resilience.quota.QuotaTracker;
import com.example.resilience.ratelimiter.MultiCategoryRateLimiter;
import com.example.resilience.ratelimiter.core.RateLimitResult;
import com.example.resilience.util.TimeUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * 요청 처리 순서를 묶은 게이트
 *
 * <ol>
 *   <li>카테고리 Rate Limit 확인, 거부되면 재시도 시간과 함께 중단</li>
 *   <li>쿼터 대상 작업이면 쿼터 확인, 소진되면 사유와 함께 중단</li>
 *   <li>작업 실행, 성공한 경우에만 쿼터 차감</li>
 * </ol>
 *
 * 작업 자체의 실패는 감싸지 않은 원래 예외로 future에 전달됩니다.
 */
@Slf4j
@RequiredArgsConstructor
public class RequestGuard {

    private final MultiCategoryRateLimiter rateLimiter;
    private final QuotaTracker quotaTracker;

    /**
     * @param userId 유저 식별자
     * @param category Rate Limit 카테고리
     * @param quotaOperation 쿼터 대상 작업 이름 (쿼터 대상이 아니면 null)
     * @param operation 보호할 작업
     */
    public <T> CompletableFuture<GuardedResult<T>> execute(long userId, String category, String quotaOperation,
                                                           AsyncOperation<T> operation) {
        RateLimitResult rateLimit = rateLimiter.isAllowed(userId, category);
        if (!rateLimit.isAllowed()) {
            long retryAfter = rateLimit.getRetryAfterSeconds();
            return CompletableFuture.completedFuture(
                    GuardedResult.rateLimited(retryAfter, TimeUtil.waitMessage(retryAfter)));
        }

        if (quotaOperation != null) {
            QuotaCheckResult quota = quotaTracker.checkQuota(userId, quotaOperation);
            if (!quota.isAllowed()) {
                log.info("Quota denied - user: {}, operation: {}, reason: {}", userId, quotaOperation, quota.getReason());
                return CompletableFuture.completedFuture(GuardedResult.quotaExceeded(quota.getReason()));
            }
        }

        CompletableFuture<GuardedResult<T>> result = new CompletableFuture<>();
        AsyncOperations.start(operation).whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(error);
                return;
            }
            if (quotaOperation != null) {
                quotaTracker.useQuota(userId, quotaOperation);
            }
            result.complete(GuardedResult.completed(value));
        });
        return result;
    }
}

package com.example.resilience.retry;

import com.example.resilience.operation.AsyncFunction;
import com.example.resilience.operation.AsyncOperation;
import com.example.resilience.operation.AsyncOperations;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 실패할 수 있는 비동기 원격 호출을 지수 백오프로 재시도하는 실행기
 *
 * <p>i번째(0부터) 시도가 실패하면 {@code baseDelay × 2^i} 만큼 기다린 뒤 다시 시도하며,
 * 최대 {@code maxRetries + 1}번 시도합니다. 마지막 시도의 예외는 그대로 호출자에게 전달됩니다.
 *
 * <p>재시도 자체는 resilience4j {@link Retry}가 수행하고, 백오프 대기는 주어진 스케줄러에 예약되어
 * 호출 스레드를 막지 않습니다. 호출 이름마다 하나의 Retry 인스턴스가 레지스트리에 등록됩니다.
 *
 * <p>예외 종류를 구분하지 않습니다. 일시적인 네트워크 오류와 프로그래밍 오류 모두 같은 재시도 절차를 거칩니다.
 * 외부 데드라인이나 취소는 없습니다.
 */
@Slf4j
public class RetryExecutor {

    private final RetryPolicy policy;
    private final ScheduledExecutorService scheduler;
    private final RetryRegistry retryRegistry;

    public RetryExecutor(RetryPolicy policy, ScheduledExecutorService scheduler) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.retryRegistry = RetryRegistry.of(policy.toRetryConfig());
        this.retryRegistry.getEventPublisher().onEntryAdded(event -> registerLogging(event.getAddedEntry()));
    }

    /**
     * 재시도를 적용해 호출을 실행합니다.
     *
     * @param operationName 로그와 Retry 인스턴스 이름으로 쓰이는 호출 이름
     * @param operation 실제 호출
     * @return 성공 값 또는 마지막 실패 예외로 완료되는 future
     */
    public <T> CompletableFuture<T> execute(String operationName, AsyncOperation<T> operation) {
        return Retry.decorateCompletionStage(retry(operationName), scheduler, () -> AsyncOperations.start(operation))
                .get()
                .toCompletableFuture();
    }

    //호출을 재시도가 적용된 동등한 호출로 감싼다
    public <T> AsyncOperation<T> wrap(String operationName, AsyncOperation<T> operation) {
        return () -> execute(operationName, operation);
    }

    public <A, T> AsyncFunction<A, T> wrapFunction(String operationName, AsyncFunction<A, T> function) {
        return argument -> execute(operationName, function.bind(argument));
    }

    //같은 스케줄러를 쓰면서 정책만 다른 실행기
    public RetryExecutor withPolicy(RetryPolicy newPolicy) {
        return new RetryExecutor(newPolicy, scheduler);
    }

    //호출 이름에 해당하는 Retry (이벤트 구독, 메트릭 조회용)
    public Retry retry(String operationName) {
        return retryRegistry.retry(operationName);
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    private static void registerLogging(Retry retry) {
        retry.getEventPublisher()
                .onRetry(event -> log.warn("Operation {} failed (attempt {}), retrying in {}ms: {}",
                        event.getName(), event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                        String.valueOf(event.getLastThrowable())))
                .onSuccess(event -> log.info("Operation {} succeeded after {} retries",
                        event.getName(), event.getNumberOfRetryAttempts()))
                .onError(event -> log.error("Operation {} failed after {} attempts: {}",
                        event.getName(), event.getNumberOfRetryAttempts(), String.valueOf(event.getLastThrowable())));
    }
}

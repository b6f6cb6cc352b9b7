package com.example.resilience.operation;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * AsyncOperation 실행 보조 메서드
 */
public final class AsyncOperations {

    private AsyncOperations() {
    }

    /**
     * 호출을 시작하고 결과를 원래 예외 그대로 전달하는 future로 돌려줍니다.
     * 동기적으로 던진 예외와 실패한 stage 모두 같은 형태의 실패로 바뀝니다.
     */
    public static <T> CompletableFuture<T> start(AsyncOperation<T> operation) {
        CompletableFuture<T> result = new CompletableFuture<>();
        CompletableFuture<T> stage;
        try {
            stage = Objects.requireNonNull(operation.call(), "operation returned null stage").toCompletableFuture();
        } catch (Exception e) {
            result.completeExceptionally(e);
            return result;
        }

        stage.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else {
                result.complete(value);
            }
        });
        return result;
    }

    // 의존 stage가 덧씌운 CompletionException/ExecutionException 을 벗겨 원래 예외를 얻는다
    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

package com.example.resilience.operation;

import java.util.concurrent.CompletionStage;

/**
 * 단일 인자를 받는 비동기 원격 호출
 *
 * @param <A> 인자 타입
 * @param <T> 결과 타입
 */
@FunctionalInterface
public interface AsyncFunction<A, T> {

    CompletionStage<T> apply(A argument) throws Exception;

    //인자를 고정하여 AsyncOperation으로 변환
    default AsyncOperation<T> bind(A argument) {
        return () -> apply(argument);
    }
}

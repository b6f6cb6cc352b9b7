package com.example.resilience.operation;

import java.util.concurrent.CompletionStage;

/**
 * 인자 없는 비동기 원격 호출
 * 동기적으로 예외를 던지거나 실패한 CompletionStage를 반환하는 두 경우 모두 "실패"로 취급합니다.
 *
 * @param <T> 결과 타입
 */
@FunctionalInterface
public interface AsyncOperation<T> {

    CompletionStage<T> call() throws Exception;
}

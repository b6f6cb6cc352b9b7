package com.example.resilience.retry;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 재시도 백오프 대기용 스케줄러 생성
 */
@Slf4j
public final class RetrySchedulers {

    private RetrySchedulers() {
    }

    /**
     * 데몬 스레드로 동작하는 백오프 스케줄러
     *
     * <p>종료(shutdown)된 뒤에 예약되는 재시도는 대기 없이 호출 스레드에서 바로 실행됩니다.
     * 진행 중인 재시도는 남은 시도를 마치고 결과 또는 마지막 호출 예외로 완료됩니다.
     *
     * @param threads 스레드 수
     * @param threadNamePrefix 스레드 이름 접두사
     */
    public static ScheduledExecutorService newBackoffScheduler(int threads, String threadNamePrefix) {
        AtomicInteger threadCount = new AtomicInteger();

        return new ScheduledThreadPoolExecutor(threads,
                runnable -> {
                    Thread thread = new Thread(runnable, threadNamePrefix + threadCount.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                (task, executor) -> {
                    log.warn("Backoff scheduler is shut down, running retry without delay");
                    task.run();
                });
    }
}

package com.example.resilience.pipeline;

import com.example.resilience.cache.CacheKeyGenerator;
import com.example.resilience.cache.CacheStore;
import com.example.resilience.cache.Memoizer;
import com.example.resilience.operation.AsyncFunction;
import com.example.resilience.operation.AsyncOperation;
import com.example.resilience.retry.RetryExecutor;
import com.example.resilience.retry.RetryPolicy;
import com.example.resilience.retry.RetrySchedulers;
import com.example.resilience.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RemoteCallPipeline 테스트")
class RemoteCallPipelineTest {

    private MutableClock clock;
    private CacheStore<Object> store;
    private ScheduledExecutorService scheduler;
    private RetryExecutor retryExecutor;
    private RemoteCallPipeline pipeline;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(1_700_000_000_000L);
        store = new CacheStore<>(100, Duration.ofHours(1), clock);
        scheduler = RetrySchedulers.newBackoffScheduler(1, "pipeline-test-");
        retryExecutor = new RetryExecutor(RetryPolicy.of(3, Duration.ofMillis(10)), scheduler);
        pipeline = new RemoteCallPipeline(new Memoizer(store, new CacheKeyGenerator()), retryExecutor);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    @DisplayName("재시도 끝에 성공한 결과가 캐시되어 다음 호출은 원격 호출 없이 응답해야 함")
    void testRetryThenCache() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        AsyncFunction<String, String> lookup = pipeline.cachedRemoteCall("getProduct", String.class,
                Duration.ofMinutes(10), barcode -> {
                    if (calls.incrementAndGet() == 1) {
                        return CompletableFuture.failedFuture(new IOException("timeout"));
                    }
                    return CompletableFuture.completedFuture("product-" + barcode);
                });

        assertEquals("product-880", lookup.apply("880").toCompletableFuture().get());
        assertEquals("product-880", lookup.apply("880").toCompletableFuture().get());

        assertEquals(2, calls.get(), "첫 호출의 재시도 1회를 포함해 2번만 호출되어야 합니다");
        assertEquals(1, retryExecutor.retry("getProduct").getMetrics().getNumberOfSuccessfulCallsWithRetryAttempt());
        assertEquals(1, store.size());
    }

    @Test
    @DisplayName("재시도가 모두 실패하면 예외가 전달되고 캐시되지 않아야 함")
    void testExhaustedFailureNotCached() {
        AtomicInteger calls = new AtomicInteger();
        AsyncFunction<String, String> lookup = pipeline.cachedRemoteCall("getProduct", String.class,
                Duration.ofMinutes(10), RetryPolicy.of(1, Duration.ofMillis(100)),
                barcode -> {
                    calls.incrementAndGet();
                    return CompletableFuture.failedFuture(new IOException("down"));
                });

        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> lookup.apply("880").toCompletableFuture().get());

        assertInstanceOf(IOException.class, thrown.getCause());
        assertEquals(2, calls.get(), "호출 지점 정책대로 2번 시도되어야 합니다");
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("쓰기 호출은 재시도만 적용되고 캐시되지 않아야 함")
    void testRemoteCallWithoutCache() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        AsyncOperation<Boolean> save = pipeline.remoteCall("saveHistory", () -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(true);
        });

        assertTrue(save.call().toCompletableFuture().get());
        assertTrue(save.call().toCompletableFuture().get());

        assertEquals(2, calls.get());
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("호출 지점별 정책으로 재시도 횟수를 바꿀 수 있어야 함")
    void testRemoteCallWithPolicy() {
        AtomicInteger calls = new AtomicInteger();
        AsyncOperation<Void> write = pipeline.remoteCall("write", RetryPolicy.of(0, Duration.ofMillis(1)), () -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new IOException("rejected"));
        });

        assertThrows(ExecutionException.class, () -> write.call().toCompletableFuture().get());
        assertEquals(1, calls.get());
    }
}

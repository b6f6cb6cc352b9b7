package com.example.resilience.cache;

import com.example.resilience.operation.AsyncFunction;
import com.example.resilience.operation.AsyncOperation;
import com.example.resilience.support.MutableClock;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Memoizer 테스트
 */
@Slf4j
@DisplayName("Memoizer 테스트")
class MemoizerTest {

    private MutableClock clock;
    private CacheStore<Object> store;
    private Memoizer memoizer;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(1_700_000_000_000L);
        store = new CacheStore<>(100, Duration.ofHours(1), clock);
        memoizer = new Memoizer(store, new CacheKeyGenerator());
    }

    @Test
    @DisplayName("TTL 안의 두 번째 호출은 캐시에서 응답하고, TTL 이후에는 다시 호출해야 함")
    void testCachedWithinTtl() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        AsyncFunction<Integer, Integer> lookup = memoizer.memoize("double", Integer.class, Duration.ofSeconds(5),
                x -> {
                    calls.incrementAndGet();
                    return CompletableFuture.completedFuture(x * 2);
                });

        assertEquals(2, lookup.apply(1).toCompletableFuture().get());
        clock.advance(Duration.ofSeconds(2));
        assertEquals(2, lookup.apply(1).toCompletableFuture().get());
        assertEquals(1, calls.get(), "TTL 안에서는 한 번만 호출되어야 합니다");

        clock.advance(Duration.ofSeconds(4));
        assertEquals(2, lookup.apply(1).toCompletableFuture().get());
        assertEquals(2, calls.get(), "TTL 이후에는 다시 호출되어야 합니다");

        log.info("메모이제이션 TTL 테스트 완료 - 실제 호출 수: {}", calls.get());
    }

    @Test
    @DisplayName("인자가 다르면 별도의 캐시 엔트리를 사용해야 함")
    void testDifferentArgumentsAreSeparate() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        AsyncFunction<String, String> lookup = memoizer.memoize("product", String.class, Duration.ofMinutes(1),
                barcode -> {
                    calls.incrementAndGet();
                    return CompletableFuture.completedFuture("product-" + barcode);
                });

        assertEquals("product-111", lookup.apply("111").toCompletableFuture().get());
        assertEquals("product-222", lookup.apply("222").toCompletableFuture().get());
        assertEquals("product-111", lookup.apply("111").toCompletableFuture().get());

        assertEquals(2, calls.get());
        assertEquals(2, store.size());
    }

    @Test
    @DisplayName("실패한 호출은 캐시되지 않고 예외가 그대로 전달되어야 함")
    void testFailureNotCached() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        IOException failure = new IOException("upstream down");
        AsyncOperation<String> flaky = memoizer.memoizeOperation("flaky", String.class, Duration.ofMinutes(1), () -> {
            if (calls.incrementAndGet() == 1) {
                return CompletableFuture.failedFuture(failure);
            }
            return CompletableFuture.completedFuture("ok");
        });

        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> flaky.call().toCompletableFuture().get());
        assertSame(failure, thrown.getCause(), "원래 예외가 전달되어야 합니다");
        assertEquals(0, store.size(), "실패는 캐시되지 않아야 합니다");

        assertEquals("ok", flaky.call().toCompletableFuture().get());
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("비동기 실패는 CompletionException으로 감싸지 않고 원래 예외로 전달되어야 함")
    void testFailureIsNotWrapped() throws Exception {
        IOException failure = new IOException("upstream down");
        AsyncOperation<String> failing = memoizer.memoizeOperation("failing", String.class, Duration.ofMinutes(1),
                () -> CompletableFuture.failedFuture(failure));

        String recovered = failing.call().toCompletableFuture()
                .exceptionally(error -> error == failure ? "recovered" : "wrapped: " + error)
                .get();
        assertEquals("recovered", recovered, "exceptionally에도 원래 예외가 보여야 합니다");

        Throwable handled = failing.call().toCompletableFuture().handle((value, error) -> error).get();
        assertSame(failure, handled);
    }

    @Test
    @DisplayName("JSON 속성이 없는 인자라도 값이 다르면 다른 결과를 받아야 함")
    void testPropertylessArgumentsDoNotCollide() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        AsyncFunction<Barcode, String> lookup = memoizer.memoize("lookupBarcode", String.class, Duration.ofMinutes(1),
                barcode -> {
                    calls.incrementAndGet();
                    return CompletableFuture.completedFuture("product-" + barcode);
                });

        assertEquals("product-880111", lookup.apply(new Barcode("880111")).toCompletableFuture().get());
        assertEquals("product-880222", lookup.apply(new Barcode("880222")).toCompletableFuture().get());
        assertEquals("product-880111", lookup.apply(new Barcode("880111")).toCompletableFuture().get());

        assertEquals(2, calls.get(), "같은 바코드만 캐시에서 응답해야 합니다");
    }

    @Test
    @DisplayName("결과 타입이 다른 캐시 값은 미스로 취급해야 함")
    void testMismatchedCachedTypeIsMiss() throws Exception {
        String cacheKey = memoizer.getKeyGenerator().generate("count", CallArguments.empty());
        store.set(cacheKey, "not a number");

        Integer result = memoizer.invoke("count", Integer.class, Duration.ofMinutes(1), CallArguments.empty(),
                () -> CompletableFuture.completedFuture(7)).get();

        assertEquals(7, result);
        assertEquals(Optional.of(7), store.get(cacheKey));
    }

    @Test
    @DisplayName("동기적으로 던진 예외도 실패한 future로 전달되어야 함")
    void testSynchronousThrow() {
        AsyncOperation<String> broken = memoizer.memoizeOperation("broken", String.class, null, () -> {
            throw new IllegalStateException("boom");
        });

        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> broken.call().toCompletableFuture().get());
        assertInstanceOf(IllegalStateException.class, thrown.getCause());
    }

    @Test
    @DisplayName("null 결과는 반환되지만 캐시되지 않아야 함")
    void testNullNotCached() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        AsyncOperation<String> empty = memoizer.memoizeOperation("empty", String.class, Duration.ofMinutes(1), () -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(null);
        });

        assertNull(empty.call().toCompletableFuture().get());
        assertNull(empty.call().toCompletableFuture().get());
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("이름 있는 인자의 순서가 달라도 같은 캐시 엔트리를 써야 함")
    void testNamedArgumentOrder() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        AsyncOperation<String> search = () -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture("results");
        };

        CallArguments first = CallArguments.of("milk").with("limit", 10).with("page", 1);
        CallArguments second = CallArguments.of("milk").with("page", 1).with("limit", 10);

        memoizer.invoke("search", String.class, Duration.ofMinutes(1), first, search).get();
        memoizer.invoke("search", String.class, Duration.ofMinutes(1), second, search).get();

        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("완료 전의 동시 미스는 하나로 합쳐지지 않아야 함")
    void testConcurrentMissesAreNotDeduplicated() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CompletableFuture<String> pending = new CompletableFuture<>();
        AsyncOperation<String> slow = memoizer.memoizeOperation("slow", String.class, Duration.ofMinutes(1), () -> {
            calls.incrementAndGet();
            return pending;
        });

        CompletableFuture<String> first = slow.call().toCompletableFuture();
        CompletableFuture<String> second = slow.call().toCompletableFuture();
        assertEquals(2, calls.get(), "두 호출 모두 실제 함수를 실행해야 합니다");

        pending.complete("done");
        assertEquals("done", first.get());
        assertEquals("done", second.get());
        assertEquals(1, store.size(), "같은 슬롯에 기록되어야 합니다");

        slow.call().toCompletableFuture().get();
        assertEquals(2, calls.get(), "완료 후에는 캐시에서 응답해야 합니다");
    }

    @Test
    @DisplayName("음수 TTL로는 메모이즈할 수 없어야 함")
    void testNegativeTtlRejected() {
        assertThrows(IllegalArgumentException.class, () ->
                memoizer.memoizeOperation("bad", Integer.class, Duration.ofSeconds(-1), () -> CompletableFuture.completedFuture(1)));
    }

    // JSON으로 드러나는 속성이 없는 인자
    private static final class Barcode {
        private final String digits;

        private Barcode(String digits) {
            this.digits = digits;
        }

        @Override
        public String toString() {
            return digits;
        }
    }
}

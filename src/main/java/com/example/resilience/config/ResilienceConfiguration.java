package com.example.resilience.config;

import com.example.resilience.cache.CacheKeyGenerator;
import com.example.resilience.cache.CacheProperties;
import com.example.resilience.cache.CacheStore;
import com.example.resilience.cache.Memoizer;
import com.example.resilience.guard.RequestGuard;
import com.example.resilience.pipeline.RemoteCallPipeline;
import com.example.resilience.quota.QuotaProperties;
import com.example.resilience.quota.QuotaTracker;
import com.example.resilience.ratelimiter.MultiCategoryRateLimiter;
import com.example.resilience.ratelimiter.config.RateLimiterFactory;
import com.example.resilience.ratelimiter.config.RateLimiterProperties;
import com.example.resilience.retry.RetryExecutor;
import com.example.resilience.retry.RetryProperties;
import com.example.resilience.retry.RetrySchedulers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 복원력 계층 구성
 *
 * 캐시, Rate Limiter, 쿼터, 재시도 인스턴스를 애플리케이션 루트에서 한 번씩 생성하고
 * 필요한 곳에 주입합니다. 전역 정적 인스턴스는 두지 않습니다.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({
        CacheProperties.class,
        RateLimiterProperties.class,
        QuotaProperties.class,
        RetryProperties.class
})
public class ResilienceConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    // =========================== 캐시 ===========================

    @Bean
    public CacheStore<Object> cacheStore(CacheProperties properties, Clock clock) {
        return new CacheStore<>(properties.getMaxSize(), properties.getDefaultTtl(), clock);
    }

    @Bean
    public CacheKeyGenerator cacheKeyGenerator(CacheProperties properties) {
        return new CacheKeyGenerator(properties.getKeyPrefix());
    }

    @Bean
    public Memoizer memoizer(CacheStore<Object> cacheStore, CacheKeyGenerator cacheKeyGenerator) {
        return new Memoizer(cacheStore, cacheKeyGenerator);
    }

    // =========================== Rate Limit / 쿼터 ===========================

    @Bean
    public RateLimiterFactory rateLimiterFactory(RateLimiterProperties properties, Clock clock) {
        return new RateLimiterFactory(properties, clock);
    }

    @Bean
    public MultiCategoryRateLimiter multiCategoryRateLimiter(RateLimiterFactory rateLimiterFactory) {
        return rateLimiterFactory.createMultiCategoryRateLimiter();
    }

    @Bean
    public QuotaTracker quotaTracker(QuotaProperties properties, Clock clock) {
        return new QuotaTracker(properties.getDaily(), properties.getMonthly(), clock);
    }

    @Bean
    public RequestGuard requestGuard(MultiCategoryRateLimiter multiCategoryRateLimiter, QuotaTracker quotaTracker) {
        return new RequestGuard(multiCategoryRateLimiter, quotaTracker);
    }

    // =========================== 재시도 ===========================

    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService retryBackoffScheduler(RetryProperties properties) {
        log.info("Creating retry backoff scheduler with {} threads", properties.getSchedulerThreads());
        return RetrySchedulers.newBackoffScheduler(properties.getSchedulerThreads(), "retry-backoff-");
    }

    @Bean
    public RetryExecutor retryExecutor(RetryProperties properties, ScheduledExecutorService retryBackoffScheduler) {
        log.info("Creating RetryExecutor with policy: {}", properties.toPolicy());
        return new RetryExecutor(properties.toPolicy(), retryBackoffScheduler);
    }

    @Bean
    public RemoteCallPipeline remoteCallPipeline(Memoizer memoizer, RetryExecutor retryExecutor) {
        return new RemoteCallPipeline(memoizer, retryExecutor);
    }
}

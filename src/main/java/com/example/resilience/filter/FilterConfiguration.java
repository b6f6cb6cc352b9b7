package com.example.resilience.filter;

import com.example.resilience.ratelimiter.MultiCategoryRateLimiter;
import com.example.resilience.ratelimiter.config.RateLimiterProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

import java.time.Clock;

/**
 * Rate Limit Filter 등록 및 설정
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class FilterConfiguration {

    private final MultiCategoryRateLimiter multiCategoryRateLimiter;
    private final RateLimiterProperties rateLimiterProperties;
    private final Clock clock;

    //RateLimitFilter를 Spring Boot에 등록
    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration() {
        FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>();

        registration.setFilter(new RateLimitFilter(multiCategoryRateLimiter, rateLimiterProperties, clock));

        // 서블릿 URL 패턴 - API 요청에만 적용 (관리자 엔드포인트 제외)
        registration.addUrlPatterns("/api/*");
        registration.setName("rateLimitFilter");

        // 가능한 한 빨리 실행되도록
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);

        log.info("RateLimitFilter registered with URL patterns: /api/*");

        return registration;
    }
}

package com.example.resilience.filter;

import com.example.resilience.ratelimiter.MultiCategoryRateLimiter;
import com.example.resilience.ratelimiter.config.RateLimiterProperties;
import com.example.resilience.ratelimiter.core.RateLimitResult;
import com.example.resilience.ratelimiter.window.RateWindow;
import com.example.resilience.util.ResponseUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;

/**
 * 요청을 핸들러로 넘기기 전에 카테고리별 Rate Limit을 적용하는 서블릿 필터
 * 거부된 요청은 Retry-After 헤더와 함께 429로 응답합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class RateLimitFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final MultiCategoryRateLimiter rateLimiter;
    private final RateLimiterProperties properties;
    private final Clock clock;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        // Rate Limiter가 비활성화된 경우 통과
        if (!properties.isEnabled()) {
            filterChain.doFilter(request, response);
            return;
        }

        RateLimitResult result;
        long userId;
        int limit;
        try {
            // 1. 사용자 ID 추출
            userId = extractUserId(request);

            // 2. 요청 경로에 따른 카테고리 선택
            String category = resolveCategory(request.getRequestURI());
            RateWindow window = rateLimiter.resolve(category);
            limit = window.getCapacity();

            // 3. Rate Limiting 검사
            result = window.isAllowed(userId);
        } catch (RuntimeException e) {
            log.error("Error in RateLimitFilter", e);
            // 에러 발생 시 요청을 통과시킴 (fail-open)
            filterChain.doFilter(request, response);
            return;
        }

        // 4. 응답 헤더 설정
        ResponseUtil.setRateLimitHeaders(response, result, limit);

        // 5. 결과에 따른 처리
        if (result.isAllowed()) {
            filterChain.doFilter(request, response);
        } else {
            ResponseUtil.logRejectedRequest(userId, result, request.getRequestURI());
            ResponseUtil.sendTooManyRequestsResponse(response, result, clock.millis());
        }
    }

    /**
     * 헤더에서 사용자 ID 추출
     * 지정된 유저 ID 헤더를 먼저 보고, 없으면 Bearer 토큰 값을 숫자 ID로 해석합니다.
     */
    long extractUserId(HttpServletRequest request) {
        String userIdHeader = request.getHeader(properties.getUserIdHeader());
        if (userIdHeader != null && !userIdHeader.isBlank()) {
            try {
                return Long.parseLong(userIdHeader.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid {} header: {}, treating request as anonymous", properties.getUserIdHeader(), userIdHeader);
                return properties.getAnonymousUserId();
            }
        }

        String authHeader = request.getHeader("Authorization");
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            String token = authHeader.substring(BEARER_PREFIX.length());
            try {
                return Long.parseLong(token.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid Bearer token format, treating request as anonymous");
            }
        }

        log.debug("No user id found, using anonymous id: {}", properties.getAnonymousUserId());
        return properties.getAnonymousUserId();
    }

    //요청 경로에 따른 카테고리 선택 (매칭되는 패턴이 없으면 general)
    String resolveCategory(String requestPath) {
        for (Map.Entry<String, String> entry : properties.getUrlPatterns().entrySet()) {
            if (pathMatcher.match(entry.getKey(), requestPath)) {
                log.debug("Matched pattern '{}' for path '{}'", entry.getKey(), requestPath);
                return entry.getValue();
            }
        }
        return MultiCategoryRateLimiter.GENERAL;
    }
}

package com.example.resilience.util;

import com.example.resilience.ratelimiter.core.RateLimitResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rate Limiting 응답 처리 유틸리티
 */
@Slf4j
public final class ResponseUtil {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    // Rate Limiting 관련 HTTP 헤더
    public static final String HEADER_RATE_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_RATE_LIMIT_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RATE_LIMIT_RESET = "X-RateLimit-Reset";
    public static final String HEADER_RATE_LIMIT_CATEGORY = "X-RateLimit-Category";
    public static final String HEADER_RETRY_AFTER = "Retry-After";

    private ResponseUtil() {
    }

    /**
     * Rate Limiting 응답 헤더 설정
     */
    public static void setRateLimitHeaders(HttpServletResponse response, RateLimitResult result, int limit) {
        response.setHeader(HEADER_RATE_LIMIT, String.valueOf(limit));
        response.setHeader(HEADER_RATE_LIMIT_REMAINING, String.valueOf(result.getRemainingRequests()));
        response.setHeader(HEADER_RATE_LIMIT_RESET, String.valueOf(result.getResetTimeMillis() / 1000));
        response.setHeader(HEADER_RATE_LIMIT_CATEGORY, result.getCategory());

        // 요청이 거부된 경우 Retry-After 헤더 추가
        if (!result.isAllowed() && result.getRetryAfterSeconds() != null) {
            response.setHeader(HEADER_RETRY_AFTER, String.valueOf(result.getRetryAfterSeconds()));
        }
    }

    /**
     * 429 Too Many Requests 응답 생성
     */
    public static void sendTooManyRequestsResponse(HttpServletResponse response, RateLimitResult result,
                                                   long timestampMillis) throws IOException {
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");

        String jsonResponse = objectMapper.writeValueAsString(createErrorResponse(result, timestampMillis));

        response.getWriter().write(jsonResponse);
        response.getWriter().flush();

        log.debug("429 response sent for category: {}, retry after: {}s",
                result.getCategory(), result.getRetryAfterSeconds());
    }

    /**
     * 에러 응답 JSON 객체 생성
     */
    private static Map<String, Object> createErrorResponse(RateLimitResult result, long timestampMillis) {
        long retryAfter = result.getRetryAfterSeconds() != null ? result.getRetryAfterSeconds() : 0;

        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", "Too Many Requests");
        error.put("message", TimeUtil.waitMessage(retryAfter));
        error.put("status", HttpStatus.TOO_MANY_REQUESTS.value());
        error.put("timestamp", timestampMillis);

        // Rate Limiting 상세 정보
        Map<String, Object> rateLimitInfo = new LinkedHashMap<>();
        rateLimitInfo.put("category", result.getCategory());
        rateLimitInfo.put("resetTime", result.getResetTimeMillis());
        rateLimitInfo.put("resetTimeFormatted", TimeUtil.formatTimestamp(result.getResetTimeMillis()));
        rateLimitInfo.put("retryAfter", retryAfter);

        error.put("rateLimit", rateLimitInfo);

        return error;
    }

    /**
     * Rate Limiting 거부 응답 로깅
     */
    public static void logRejectedRequest(long userId, RateLimitResult result, String requestPath) {
        log.warn("Request rejected - user: {}, path: {}, category: {}, retry after: {}s",
                userId, requestPath, result.getCategory(), result.getRetryAfterSeconds());
    }
}

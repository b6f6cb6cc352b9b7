package com.example.resilience.ratelimiter.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rate Limiter 설정 프로퍼티
 */
@Data
@Validated
@ConfigurationProperties(prefix = "resilience.rate-limiter")
public class RateLimiterProperties {

    private boolean enabled = true; // HTTP 필터 활성화
    @NotBlank
    private String userIdHeader = "X-User-Id"; // 유저 ID를 담은 요청 헤더
    private long anonymousUserId = 0L; // 유저 ID를 알 수 없는 요청에 사용할 ID
    @Valid
    private Map<String, WindowConfig> categories = defaultCategories(); // 카테고리별 윈도우 설정
    private Map<String, String> urlPatterns = new LinkedHashMap<>(); // URL 패턴 → 카테고리

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WindowConfig {
        @Min(1)
        private int capacity; // 윈도우 내 최대 요청 수
        @Min(1)
        private long windowSeconds; // 윈도우 크기 (초)
    }

    /**
     * 기본 카테고리 설정
     * 이미지 분석은 일반 요청보다 훨씬 엄격하게 제한합니다.
     */
    public static Map<String, WindowConfig> defaultCategories() {
        Map<String, WindowConfig> categories = new LinkedHashMap<>();
        categories.put("general", new WindowConfig(30, 60));
        categories.put("search", new WindowConfig(20, 60));
        categories.put("image_analysis", new WindowConfig(5, 60));
        categories.put("barcode", new WindowConfig(10, 60));
        return categories;
    }
}

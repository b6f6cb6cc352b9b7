package com.example.resilience.cache;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 캐시 설정 프로퍼티
 */
@Data
@Validated
@ConfigurationProperties(prefix = "resilience.cache")
public class CacheProperties {

    @Min(1)
    private int maxSize = 1000; // 최대 엔트리 수
    @NotNull
    private Duration defaultTtl = Duration.ofHours(1); // 기본 TTL
    private String keyPrefix = ""; // 메모이제이션 키 접두사
}

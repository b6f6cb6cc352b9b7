package com.example.resilience.retry;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 재시도 설정 프로퍼티
 */
@Data
@Validated
@ConfigurationProperties(prefix = "resilience.retry")
public class RetryProperties {

    @Min(0)
    @Max(RetryPolicy.MAX_RETRIES_LIMIT)
    private int maxRetries = 3; // 최대 재시도 횟수
    @NotNull
    private Duration baseDelay = Duration.ofSeconds(1); // 첫 재시도 전 대기 시간
    @Min(1)
    private int schedulerThreads = 2; // 백오프 대기용 스케줄러 스레드 수

    public RetryPolicy toPolicy() {
        return RetryPolicy.of(maxRetries, baseDelay);
    }
}

package com.example.resilience.quota;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 쿼터 확인 결과
 * 쿼터 소진은 예외가 아니라 allowed=false 와 사유 문자열로 전달됩니다.
 */
@Getter
@ToString
@AllArgsConstructor
public class QuotaCheckResult {

    private static final String AVAILABLE = "quota available";

    private final boolean allowed; // 작업 허용 여부
    private final String reason; // 판정 사유 (처음으로 초과된 한도)

    public static QuotaCheckResult available() {
        return new QuotaCheckResult(true, AVAILABLE);
    }

    public static QuotaCheckResult dailyExceeded(long limit) {
        return new QuotaCheckResult(false, "daily limit of " + limit + " exceeded");
    }

    public static QuotaCheckResult monthlyExceeded(long limit) {
        return new QuotaCheckResult(false, "monthly limit of " + limit + " exceeded");
    }
}

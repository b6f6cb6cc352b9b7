package com.example.resilience.guard;

/**
 * 보호된 실행의 결과 상태
 */
public enum GuardStatus {
    COMPLETED,      // 작업 실행 완료
    RATE_LIMITED,   // 카테고리 Rate Limit 초과로 실행하지 않음
    QUOTA_EXCEEDED  // 일간/월간 쿼터 소진으로 실행하지 않음
}

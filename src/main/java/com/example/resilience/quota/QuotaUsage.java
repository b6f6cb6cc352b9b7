package com.example.resilience.quota;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * 유저 한 명의 작업별 사용량 스냅샷
 */
@Getter
@AllArgsConstructor
public class QuotaUsage {
    private final long userId;
    private final Map<String, Long> daily; // 작업 → 오늘 사용량
    private final Map<String, Long> monthly; // 작업 → 이번 달 사용량
}

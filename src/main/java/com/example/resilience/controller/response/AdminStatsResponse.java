package com.example.resilience.controller.response;

import com.example.resilience.quota.QuotaUsage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 관리자 유저 통계 조회 응답 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminStatsResponse {
    private Long userId; // 조회된 사용자 ID
    private String category; // 조회된 카테고리
    private Map<String, Object> stats; // 카테고리 윈도우 상태 맵
    private Map<String, Integer> remainingByCategory; // 카테고리별 남은 요청 수
    private QuotaUsage quotaUsage; // 작업별 쿼터 사용량
    private LocalDateTime timestamp; // 응답 생성 시간
}

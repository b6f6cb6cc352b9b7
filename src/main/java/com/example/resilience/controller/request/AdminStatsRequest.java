package com.example.resilience.controller.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 관리자 유저 통계 조회 요청 DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AdminStatsRequest {

    @NotNull
    private Long userId; // 조회할 사용자 ID

    @NotBlank
    private String category; // 조회할 Rate Limit 카테고리
}

package com.example.resilience.ratelimiter.core;

import java.util.Map;

/**
 * 단일 카테고리 Rate Limiter의 공통 인터페이스
 */
public interface RateLimiter {

    /**
     * 요청 허용 여부를 검사하고, 허용된 경우 요청을 기록합니다.
     *
     * @param userId 유저 식별자
     * @return Rate Limiting 결과
     */
    RateLimitResult isAllowed(long userId);

    /**
     * 현재 윈도우에서 유저가 더 보낼 수 있는 요청 수를 반환합니다.
     * 요청을 기록하지 않습니다.
     */
    int getRemainingRequests(long userId);

    /**
     * 특정 유저의 Rate Limiting 상태를 초기화합니다.
     *
     * @param userId 유저 식별자
     */
    void reset(long userId);

    /**
     * 윈도우 안에 남은 요청이 없는 유저 상태를 제거합니다.
     * 외부 스케줄러가 주기적으로 호출해야 합니다.
     *
     * @return 제거된 유저 수
     */
    int cleanup();

    /**
     * 특정 유저의 현재 상태 정보를 반환합니다.
     *
     * @param userId 유저 식별자
     * @return 상태 정보 Map
     */
    Map<String, Object> getStats(long userId);

    /**
     * 카테고리 이름을 반환합니다.
     */
    String getCategory();
}

package com.example.resilience.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * 시간 관련 유틸리티 클래스
 */
public final class TimeUtil {

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private TimeUtil() {
    }

    //초를 밀리초로 변환
    public static long secondsToMillis(long seconds) {
        return seconds * 1000;
    }

    //밀리초를 사람이 읽기 쉬운 형태로 변환
    public static String formatTimestamp(long timestampMillis) {
        LocalDateTime dateTime = LocalDateTime.ofInstant(
            Instant.ofEpochMilli(timestampMillis),
            ZoneId.systemDefault()
        );
        return dateTime.format(FORMATTER);
    }

    //재시도 권장 시간 계산 (초 단위, 1초 여유 포함)
    public static long calculateRetryAfterSeconds(long resetTimeMillis, long currentTimeMillis) {
        if (resetTimeMillis <= currentTimeMillis) {
            return 0;
        }
        return (resetTimeMillis - currentTimeMillis) / 1000 + 1;
    }

    /**
     * 대기 시간을 사용자에게 보여줄 문장으로 변환
     * 예: 45 → "45 seconds", 65 → "1 minute 5 seconds"
     */
    public static String formatWaitTime(long seconds) {
        if (seconds < 60) {
            return plural(seconds, "second");
        }
        long minutes = seconds / 60;
        long remainder = seconds % 60;
        if (remainder == 0) {
            return plural(minutes, "minute");
        }
        return plural(minutes, "minute") + " " + plural(remainder, "second");
    }

    //Rate Limit 거부 시 사용자에게 보여줄 안내 문구
    public static String waitMessage(long retryAfterSeconds) {
        return "Rate limit exceeded. Please try again in " + formatWaitTime(retryAfterSeconds) + ".";
    }

    private static String plural(long amount, String unit) {
        return amount + " " + unit + (amount == 1 ? "" : "s");
    }
}

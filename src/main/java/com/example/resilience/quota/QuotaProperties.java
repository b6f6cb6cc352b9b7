package com.example.resilience.quota;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 작업별 일간/월간 쿼터 설정
 * 설정에 없는 작업은 제한 없음으로 취급됩니다.
 */
@Data
@ConfigurationProperties(prefix = "resilience.quota")
public class QuotaProperties {

    private Map<String, Long> daily = defaultDaily();
    private Map<String, Long> monthly = defaultMonthly();

    public static Map<String, Long> defaultDaily() {
        Map<String, Long> limits = new LinkedHashMap<>();
        limits.put("image_analysis", 50L);
        limits.put("barcode_scans", 100L);
        limits.put("searches", 200L);
        return limits;
    }

    public static Map<String, Long> defaultMonthly() {
        Map<String, Long> limits = new LinkedHashMap<>();
        limits.put("image_analysis", 1000L);
        limits.put("barcode_scans", 2000L);
        limits.put("searches", 5000L);
        return limits;
    }
}

package com.example.resilience.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.DigestUtils;

import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 메모이제이션 캐시 키 생성기
 *
 * <p>함수 이름과 인자를 정렬된 JSON으로 직렬화한 뒤 MD5 해시를 계산합니다.
 * JSON 기본 타입이 아닌 인자는 문자열 표현으로 키에 반영됩니다.
 * 같은 함수에 같은 인자를 넘기면 이름 있는 인자의 순서와 관계없이 항상 같은 키가 생성됩니다.
 */
@Slf4j
public class CacheKeyGenerator {

    private static final int CONTENT_HASH_LENGTH = 16;

    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public CacheKeyGenerator() {
        this("");
    }

    public CacheKeyGenerator(String keyPrefix) {
        this.keyPrefix = keyPrefix != null ? keyPrefix : "";
        this.objectMapper = JsonMapper.builder()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .build();
    }

    /**
     * 캐시 키 생성
     *
     * @param functionName 함수 식별자
     * @param arguments 호출 인자
     * @return {@code keyPrefix + functionName + "_" + md5(인자 JSON)}
     */
    public String generate(String functionName, CallArguments arguments) {
        Map<String, Object> keyData = new LinkedHashMap<>();
        keyData.put("args", toKeyValue(arguments.getPositional()));
        keyData.put("kwargs", toKeyValue(arguments.getNamed()));

        String keyString = serialize(keyData);
        String digest = DigestUtils.md5DigestAsHex(keyString.getBytes(StandardCharsets.UTF_8));

        return keyPrefix + functionName + "_" + digest;
    }

    /**
     * 바이너리 내용(이미지 등)을 키로 쓰기 위한 해시
     * SHA-256 다이제스트의 앞 16자리 16진수 문자열을 반환합니다.
     */
    public String contentHash(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content)).substring(0, CONTENT_HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * 인자를 JSON으로 표현 가능한 형태로 변환
     * 문자열, 숫자, 불리언, null, 컬렉션, 배열, 맵만 구조를 유지하고
     * 그 밖의 객체는 {@code String.valueOf} 결과로 대체합니다.
     */
    private Object toKeyValue(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Map) {
            Map<String, Object> converted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                converted.put(String.valueOf(entry.getKey()), toKeyValue(entry.getValue()));
            }
            return converted;
        }
        if (value instanceof Collection) {
            List<Object> converted = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                converted.add(toKeyValue(element));
            }
            return converted;
        }
        if (value.getClass().isArray()) {
            List<Object> converted = new ArrayList<>();
            for (int i = 0; i < Array.getLength(value); i++) {
                converted.add(toKeyValue(Array.get(value, i)));
            }
            return converted;
        }
        return String.valueOf(value);
    }

    private String serialize(Map<String, Object> keyData) {
        try {
            return objectMapper.writeValueAsString(keyData);
        } catch (JsonProcessingException e) {
            // JSON으로 표현할 수 없는 인자는 문자열 표현으로 대체
            log.debug("Falling back to string form for cache key arguments: {}", e.getMessage());
            return String.valueOf(keyData);
        }
    }
}

package com.redisui.backend.audit.support;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 감사 로그 details 의 민감 필드 가리기
 * - 키 이름에 password / token / secret / apikey 가 들어가면 값을 "***" 로 바꾼다
 * - 중첩 Map 도 재귀적으로 처리
 */
public final class AuditDetailsMasker {
    private AuditDetailsMasker() {}

    public static final String MASK = "***";

    private static final List<String> SENSITIVE_KEYS = List.of("password", "token", "secret", "apikey", "api_key");

    public static Map<String, Object> mask(Map<String, ?> details) {
        if (details == null)
            return null;

        Map<String, Object> masked = new LinkedHashMap<>();
        details.forEach((key, value) -> {
            if (isSensitive(key)) {
                masked.put(key, MASK);
            } else if (value instanceof Map<?, ?> nested) {
                masked.put(key, mask(stringKeyed(nested)));
            } else {
                masked.put(key, value);
            }
        });
        return masked;
    }

    private static boolean isSensitive(String key) {
        if (key == null) return false;
        String lower = key.toLowerCase(Locale.ROOT);
        return SENSITIVE_KEYS.stream().anyMatch(lower::contains);
    }

    private static Map<String, Object> stringKeyed(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }
}

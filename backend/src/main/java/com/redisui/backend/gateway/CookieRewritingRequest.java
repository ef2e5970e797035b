package com.redisui.backend.gateway;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.http.HttpHeaders;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;

/**
 * 인라인 refresh 직후 요청을 다음 단계로 넘길 때 쓰는 래퍼
 *
 * 브라우저는 아직 새 쿠키를 모르므로, 이번 요청 안에서는
 * Cookie 헤더와 getCookies() 를 새 값 기준으로 다시 만들어 보여준다.
 * - replacements 에 있는 이름은 값을 교체 (없던 쿠키면 추가)
 * - removals 에 있는 이름은 제거
 */
public class CookieRewritingRequest extends HttpServletRequestWrapper {

    private final Map<String, String> cookies;

    public CookieRewritingRequest(HttpServletRequest request, Map<String, String> replacements, List<String> removals) {
        super(request);

        Map<String, String> merged = new LinkedHashMap<>();
        Cookie[] original = request.getCookies();
        if (original != null) {
            for (Cookie c : original) {
                merged.putIfAbsent(c.getName(), c.getValue());
            }
        }
        removals.forEach(merged::remove);
        merged.putAll(replacements);
        this.cookies = Collections.unmodifiableMap(merged);
    }

    @Override
    public Cookie[] getCookies() {
        if (cookies.isEmpty()) return null;

        List<Cookie> result = new ArrayList<>(cookies.size());
        cookies.forEach((name, value) -> result.add(new Cookie(name, value)));
        return result.toArray(new Cookie[0]);
    }

    @Override
    public String getHeader(String name) {
        if (HttpHeaders.COOKIE.equalsIgnoreCase(name)) {
            return cookies.isEmpty() ? null : cookieHeader();
        }
        return super.getHeader(name);
    }

    @Override
    public Enumeration<String> getHeaders(String name) {
        if (HttpHeaders.COOKIE.equalsIgnoreCase(name)) {
            return cookies.isEmpty()
                    ? Collections.emptyEnumeration()
                    : Collections.enumeration(List.of(cookieHeader()));
        }
        return super.getHeaders(name);
    }

    private String cookieHeader() {
        return cookies.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("; "));
    }
}

package com.redisui.backend.gateway;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import jakarta.servlet.http.Cookie;

@DisplayName("[Gateway] Cookie 헤더 재작성 테스트")
class CookieRewritingRequestTest {

    @Test
    @DisplayName("교체 대상은 새 값으로, 제거 대상은 빠지고, 나머지는 그대로")
    void rewrites_cookies() {
        MockHttpServletRequest original = new MockHttpServletRequest();
        original.setCookies(
                new Cookie("rds_access_token", "old-access"),
                new Cookie("token", "legacy"),
                new Cookie("theme", "dark"));

        CookieRewritingRequest rewritten = new CookieRewritingRequest(
                original,
                Map.of("rds_access_token", "new-access", "rds_refresh_token", "new-refresh"),
                List.of("token"));

        Map<String, String> cookies = Arrays.stream(rewritten.getCookies())
                .collect(Collectors.toMap(Cookie::getName, Cookie::getValue));
        assertThat(cookies).containsOnly(
                Map.entry("rds_access_token", "new-access"),
                Map.entry("rds_refresh_token", "new-refresh"),
                Map.entry("theme", "dark"));

        String header = rewritten.getHeader("Cookie");
        assertThat(header).contains("rds_access_token=new-access", "theme=dark").doesNotContain("legacy");
        assertThat(Collections.list(rewritten.getHeaders("cookie"))).containsExactly(header);
    }

    @Test
    @DisplayName("다른 헤더는 원래 요청 값")
    void other_headers_pass_through() {
        MockHttpServletRequest original = new MockHttpServletRequest();
        original.addHeader("User-Agent", "junit");

        CookieRewritingRequest rewritten = new CookieRewritingRequest(original, Map.of(), List.of());

        assertThat(rewritten.getHeader("User-Agent")).isEqualTo("junit");
        assertThat(rewritten.getCookies()).isNull();
        assertThat(rewritten.getHeader("Cookie")).isNull();
    }
}

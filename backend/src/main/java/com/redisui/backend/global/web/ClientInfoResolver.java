package com.redisui.backend.global.web;

import org.springframework.stereotype.Component;

import jakarta.servlet.http.HttpServletRequest;

/** 설정(app.client.trust-forwarded-headers)에 맞춰 요청의 ClientInfo 를 만든다 */
@Component
public class ClientInfoResolver {

    private final boolean trustForwardedHeaders;

    public ClientInfoResolver(ClientProperties props) {
        this.trustForwardedHeaders = props.trustForwardedHeaders();
    }

    public ClientInfo resolve(HttpServletRequest request) {
        return ClientInfo.from(request, trustForwardedHeaders);
    }
}

package com.redisui.backend.auth.identity.login.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.redisui.backend.global.jackson.TrimStringDeserializer;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LoginRequest(
        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank @Size(max = 50) String username,

        @NotBlank @Size(max = 200) String password,

        /**
         * remember 옵션 (null 가능)
         * - true: 세션 수명 30일
         * - false(or null): 세션 수명 1일
         */
        Boolean remember
) {
    public boolean rememberOrFalse() {
        return Boolean.TRUE.equals(remember);
    }
}

package com.redisui.backend.auth.identity.register.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.redisui.backend.auth.domain.UserRole;
import com.redisui.backend.global.jackson.TrimStringDeserializer;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * 사용자 등록 요청
 * - username 형식(영문/숫자/밑줄, 3~50자)은 서비스에서 INVALID_USERNAME 으로 검증
 * - password 복잡도는 PasswordPolicy 가 검증 (WEAK_PASSWORD + 위반 목록)
 */
public record RegisterRequest(
        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank String username,

        @NotBlank @Size(max = 200) String password,

        @NotNull UserRole role,

        @JsonProperty("isActive") Boolean isActive // null 이면 활성
) {
    public boolean activeOrTrue() {
        return !Boolean.FALSE.equals(isActive);
    }
}

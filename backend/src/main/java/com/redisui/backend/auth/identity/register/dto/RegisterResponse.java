package com.redisui.backend.auth.identity.register.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.redisui.backend.auth.domain.User;
import com.redisui.backend.auth.domain.UserRole;

public record RegisterResponse(
        Long id,
        String username,
        UserRole role,
        @JsonProperty("isActive") boolean isActive
) {

    public static RegisterResponse from(User user) {
        return new RegisterResponse(user.getId(), user.getUsername(), user.getRole(), user.isActive());
    }
}

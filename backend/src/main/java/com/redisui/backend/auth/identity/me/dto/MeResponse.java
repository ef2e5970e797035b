package com.redisui.backend.auth.identity.me.dto;

import com.redisui.backend.auth.domain.UserRole;

public record MeResponse(Long id, String username, UserRole role) {}

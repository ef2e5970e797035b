package com.redisui.backend.auth.domain;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 사용자 권한 (viewer < editor < admin)
 *
 * rank 숫자 비교로 계층을 판단한다.
 * - 상위 권한은 하위 권한이 필요한 모든 검사를 통과
 * - 새 권한 추가 시 rank만 정해주면 됨
 *
 * JSON / JWT role 클레임에서는 소문자 코드("viewer")를 사용하고
 * DB에는 enum 이름("VIEWER")으로 저장한다.
 */
public enum UserRole {

    VIEWER(1, "viewer"),
    EDITOR(2, "editor"),
    ADMIN(3, "admin");

    private final int rank;
    private final String code;

    UserRole(int rank, String code) {
        this.rank = rank;
        this.code = code;
    }

    public int rank() {
        return rank;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** 이 권한이 required 권한이 필요한 작업을 수행할 수 있는지 */
    public boolean satisfies(UserRole required) {
        return required != null && this.rank >= required.rank;
    }

    /**
     * "viewer" / "VIEWER" 둘 다 허용
     * 알 수 없는 값이면 IllegalArgumentException
     */
    @JsonCreator
    public static UserRole fromCode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        return Arrays.stream(values())
                .filter(r -> r.code.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown role: " + value));
    }
}

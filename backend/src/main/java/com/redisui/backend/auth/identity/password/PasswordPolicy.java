package com.redisui.backend.auth.identity.password;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.redisui.backend.auth.config.AuthProperties;
import com.redisui.backend.global.ApiException;
import com.redisui.backend.global.ErrorCode;

/**
 * 비밀번호 복잡도 정책 (app.auth.password.*)
 * - 최소 길이 + 대문자/소문자/숫자/특수문자 요구 여부
 * - 위반 항목을 전부 모아서 돌려준다 (UI에서 한 번에 보여주기 위함)
 */
@Component
public class PasswordPolicy {

    private static final Pattern UPPER = Pattern.compile("[A-Z]");
    private static final Pattern LOWER = Pattern.compile("[a-z]");
    private static final Pattern DIGIT = Pattern.compile("[0-9]");
    private static final Pattern SPECIAL = Pattern.compile("[^A-Za-z0-9]");

    private final AuthProperties.Password policy;

    public PasswordPolicy(AuthProperties props) {
        this.policy = props.password();
    }

    public List<String> violations(String password) {
        List<String> errors = new ArrayList<>();
        String pw = password == null ? "" : password;

        if (pw.length() < policy.minLength())
            errors.add("비밀번호는 최소 " + policy.minLength() + "자 이상이어야 합니다.");
        if (policy.requireUppercase() && !UPPER.matcher(pw).find())
            errors.add("대문자를 1개 이상 포함해야 합니다.");
        if (policy.requireLowercase() && !LOWER.matcher(pw).find())
            errors.add("소문자를 1개 이상 포함해야 합니다.");
        if (policy.requireNumber() && !DIGIT.matcher(pw).find())
            errors.add("숫자를 1개 이상 포함해야 합니다.");
        if (policy.requireSpecial() && !SPECIAL.matcher(pw).find())
            errors.add("특수문자를 1개 이상 포함해야 합니다.");

        return errors;
    }

    /** 위반이 있으면 WEAK_PASSWORD(400) + details 에 위반 목록 */
    public void validate(String password) {
        List<String> errors = violations(password);
        if (!errors.isEmpty()) {
            throw new ApiException(ErrorCode.WEAK_PASSWORD, ErrorCode.WEAK_PASSWORD.defaultMessage(), null, errors);
        }
    }
}

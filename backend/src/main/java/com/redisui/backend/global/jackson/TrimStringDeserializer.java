package com.redisui.backend.global.jackson;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

/**
 * 요청 DTO의 문자열 필드 앞뒤 공백 제거용
 * - 아이디 같은 식별자 필드에만 @JsonDeserialize(using = ...)로 붙여서 사용
 * - 비밀번호에는 절대 붙이지 않는다 (공백도 비밀번호의 일부)
 */
public class TrimStringDeserializer extends JsonDeserializer<String> {

    @Override
    public String deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        String v = p.getValueAsString();
        return v == null ? null : v.trim();
    }
}

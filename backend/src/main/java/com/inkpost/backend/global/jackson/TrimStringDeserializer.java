package com.inkpost.backend.global.jackson;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

/**
 * JSON 문자열 필드 앞뒤 공백 제거
 * - @Valid 검증 전에 적용되므로 "   " 는 빈 문자열이 되어 @NotBlank에 걸린다.
 */
public class TrimStringDeserializer extends JsonDeserializer<String> {

    @Override
    public String deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        String value = parser.getValueAsString();
        return value == null ? null : value.trim();
    }
}

package com.inkpost.backend.auth.identity.register.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.inkpost.backend.global.jackson.TrimStringDeserializer;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 회원가입 요청
 * - password는 trim 하지 않는다. (공백도 비밀번호의 일부)
 * - BCrypt는 72바이트까지만 사용하므로 그 이상은 받지 않는다.
 *   @Size는 글자 수 기준이라 1차 필터일 뿐, 바이트 검사는 RegisterService에서 한다.
 */
public record RegisterRequest(
        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank @Email @Size(max = 255)
        String email,

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank @Size(max = 30)
        String nickname,

        @NotBlank @Size(max = 72)
        String password
) {}

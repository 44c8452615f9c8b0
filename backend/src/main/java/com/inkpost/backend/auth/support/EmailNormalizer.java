package com.inkpost.backend.auth.support;

import java.util.Locale;

/**
 * 이메일 비교 기준 통일: 가입/로그인 모두 trim + 소문자로 맞춘 값을 사용한다.
 */
public final class EmailNormalizer {

    private EmailNormalizer() {
    }

    public static String normalize(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}

package com.inkpost.backend.security;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * 비밀번호 해시 (BCrypt)
 * - 매번 랜덤 salt -> 같은 평문이라도 결과가 매번 다르다.
 * - cost factor(strength)는 AuthModuleConfig의 PasswordEncoder 설정을 따른다.
 * - 일부러 느린 연산이라 요청 스레드에서 그대로 돌린다. (공유 상태 없음)
 * - BCrypt는 입력의 앞 72바이트만 본다. 그보다 긴 평문은 해싱도 비교도 하지 않는다.
 *   (글자 수가 아니라 UTF-8 바이트 기준: 한글 한 글자 = 3바이트)
 */
@Component
@RequiredArgsConstructor
public class PasswordHasher {

    public static final int MAX_PASSWORD_BYTES = 72;

    private final PasswordEncoder passwordEncoder;
    private final SecureRandom secureRandom;

    public String hash(String raw) {
        requireHashable(raw);
        return passwordEncoder.encode(raw);
    }

    /** 설정과 다른 cost로 해시가 필요할 때 (마이그레이션/테스트) */
    public String hash(String raw, int costFactor) {
        requireHashable(raw);
        return new BCryptPasswordEncoder(costFactor, secureRandom).encode(raw);
    }

    /**
     * 평문을 같은 salt/cost로 다시 해싱해서 비교한다.
     * 불일치, null, 깨진 해시, 72바이트 초과 평문 모두 예외 없이 false.
     */
    public boolean matches(String raw, String hash) {
        if (raw == null || hash == null || hash.isBlank()) {
            return false;
        }
        // 잘린 앞부분만으로 맞아떨어지는 것을 막는다.
        if (!fitsInputLimit(raw)) {
            return false;
        }
        // BCryptPasswordEncoder는 bcrypt 형식이 아닌 해시에 대해 경고 로그만 남기고 false를 준다.
        return passwordEncoder.matches(raw, hash);
    }

    public static boolean fitsInputLimit(String raw) {
        return raw.getBytes(StandardCharsets.UTF_8).length <= MAX_PASSWORD_BYTES;
    }

    private static void requireHashable(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("password must not be null");
        }
        if (!fitsInputLimit(raw)) {
            throw new IllegalArgumentException("password must not exceed " + MAX_PASSWORD_BYTES + " bytes (UTF-8)");
        }
    }
}

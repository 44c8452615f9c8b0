package com.inkpost.backend.auth.identity.login.service;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.inkpost.backend.auth.domain.User;
import com.inkpost.backend.auth.repo.UserRepository;
import com.inkpost.backend.auth.support.EmailNormalizer;
import com.inkpost.backend.global.ApiException;
import com.inkpost.backend.global.ErrorCode;
import com.inkpost.backend.security.PasswordHasher;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 이메일 + 평문 비밀번호로 사용자 인증
 * - "없는 이메일"과 "틀린 비밀번호"는 같은 INVALID_CREDENTIALS로 응답한다. (계정 존재 여부 노출 금지)
 * - 로그에도 어느 쪽이 틀렸는지 남기지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialAuthenticator {

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;

    @Transactional(readOnly = true)
    public User authenticate(String rawEmail, String rawPassword) {
        String email = EmailNormalizer.normalize(rawEmail);

        User user = userRepository.findByEmail(email).orElse(null);
        if (user == null || !passwordHasher.matches(rawPassword, user.getPasswordHash())) {
            log.info("Login rejected");
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }
        return user;
    }
}

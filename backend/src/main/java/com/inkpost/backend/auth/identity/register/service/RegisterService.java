package com.inkpost.backend.auth.identity.register.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.inkpost.backend.auth.domain.User;
import com.inkpost.backend.auth.repo.UserRepository;
import com.inkpost.backend.auth.support.EmailNormalizer;
import com.inkpost.backend.auth.token.dto.TokenPair;
import com.inkpost.backend.auth.token.service.SessionIssuer;
import com.inkpost.backend.global.ApiException;
import com.inkpost.backend.global.ErrorCode;
import com.inkpost.backend.security.PasswordHasher;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 회원가입 유스케이스
 * - 비밀번호 길이(바이트) 검사 -> 중복 검사 (email -> nickname 순)
 * - 비밀번호 해시 후 저장
 * - 가입 즉시 로그인 상태: 토큰 쌍 발급
 *
 * 동시 가입으로 중복 검사를 통과해도 users 유니크 제약이 최종 방어선이다. (-> DUPLICATE_RESOURCE)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegisterService {

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final SessionIssuer sessionIssuer;
    private final Clock clock;

    @Transactional
    public TokenPair register(String rawEmail, String rawNickname, String rawPassword) {
        String email = EmailNormalizer.normalize(rawEmail);
        String nickname = rawNickname == null ? null : rawNickname.trim();

        // @Size는 글자 수라서 멀티바이트 비밀번호는 여기서 걸러야 한다.
        if (rawPassword == null || !PasswordHasher.fitsInputLimit(rawPassword)) {
            throw new ApiException(ErrorCode.VALIDATION_ERROR, "비밀번호는 UTF-8 기준 72바이트 이하여야 합니다.");
        }

        if (userRepository.existsByEmail(email)) {
            throw new ApiException(ErrorCode.EMAIL_ALREADY_EXISTS);
        }
        if (userRepository.existsByNickname(nickname)) {
            throw new ApiException(ErrorCode.NICKNAME_ALREADY_EXISTS);
        }

        String passwordHash = passwordHasher.hash(rawPassword);
        User saved = userRepository.saveAndFlush(
                User.create(email, passwordHash, nickname, LocalDateTime.now(clock)));

        log.info("User registered: userId={}", saved.getId());
        return sessionIssuer.issueSession(saved);
    }
}

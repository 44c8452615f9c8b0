package com.inkpost.backend.auth.token.service;

import org.springframework.stereotype.Component;

import com.inkpost.backend.auth.domain.User;
import com.inkpost.backend.auth.token.dto.TokenPair;
import com.inkpost.backend.security.JwtService;
import com.inkpost.backend.security.TokenKind;

import lombok.RequiredArgsConstructor;

/**
 * 인증이 끝난 사용자에게 access/refresh 토큰 한 쌍을 발급
 * - 두 토큰은 subject/email은 같고 kind와 만료시간만 다르다.
 * - 서버에는 아무것도 저장하지 않는다.
 */
@Component
@RequiredArgsConstructor
public class SessionIssuer {

    private final JwtService jwtService;

    public TokenPair issueSession(User user) {
        String access = jwtService.issue(user.getId(), user.getEmail(), TokenKind.ACCESS);
        String refresh = jwtService.issue(user.getId(), user.getEmail(), TokenKind.REFRESH);
        return new TokenPair(access, refresh);
    }
}

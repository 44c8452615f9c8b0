package com.inkpost.backend.auth.token.service;

import org.springframework.stereotype.Service;

import com.inkpost.backend.security.JwtService;
import com.inkpost.backend.security.TokenKind;
import com.inkpost.backend.security.TokenPayload;
import com.inkpost.backend.security.WrongTokenKindException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Refresh Token으로 새 토큰 재발급
 *
 * 1) 서명/만료/issuer 검증 (JwtService.verify)
 * 2) kind == REFRESH 강제 (access 토큰으로는 재발급 불가)
 * 3) 같은 userId/email로 요청한 kind의 토큰을 새로 서명
 *
 * - DB 조회/저장 없음: 기존 refresh 토큰은 만료될 때까지 그대로 유효하다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenRotationService {

    private final JwtService jwtService;

    public String rotate(String token, boolean wantRefresh) {
        TokenPayload decoded = jwtService.verify(token);

        if (!decoded.isKind(TokenKind.REFRESH)) {
            throw new WrongTokenKindException(TokenKind.REFRESH, decoded.kind(),
                    "reissue requires a refresh token");
        }

        TokenKind target = wantRefresh ? TokenKind.REFRESH : TokenKind.ACCESS;
        String issued = jwtService.issue(decoded.userId(), decoded.email(), target);

        log.info("Token rotated: userId={}, kind={}", decoded.userId(), target);
        return issued;
    }
}

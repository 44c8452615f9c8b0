package com.inkpost.backend.security;

import java.time.Instant;

/**
 * 검증이 끝난 토큰에서 복원한 페이로드 (불변, DB에 저장하지 않음)
 * - sub -> userId, email, type -> kind, iat/exp
 */
public record TokenPayload(
        Long userId,
        String email,
        TokenKind kind,
        Instant issuedAt,
        Instant expiresAt
) {
    public boolean isKind(TokenKind expected) {
        return kind == expected;
    }
}

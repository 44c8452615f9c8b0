package com.inkpost.backend.security;

import lombok.Getter;

/**
 * 검증은 통과했지만 용도가 다른 토큰
 * - 재발급(rotate)에 access 토큰을 내민 경우
 * - 보호 리소스 접근에 refresh 토큰을 내민 경우
 */
@Getter
public class WrongTokenKindException extends InvalidTokenException {

    private final TokenKind expected;
    private final TokenKind actual;

    public WrongTokenKindException(TokenKind expected, TokenKind actual, String message) {
        super(message);
        this.expected = expected;
        this.actual = actual;
    }
}

package com.inkpost.backend.security;

/**
 * 토큰 용도 구분 (JWT "type" 클레임)
 * - ACCESS: 매 API 요청마다 신원을 증명하는 짧은 수명 토큰
 * - REFRESH: 새 토큰을 받을 때만 쓰는 긴 수명 토큰
 */
public enum TokenKind {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenKind(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static TokenKind fromClaim(String value) {
        for (TokenKind kind : values()) {
            if (kind.claimValue.equals(value)) {
                return kind;
            }
        }
        throw new InvalidTokenException("unknown token type: " + value);
    }
}

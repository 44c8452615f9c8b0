package com.inkpost.backend.security;

/**
 * "HTTP를 모르는 도메인 예외"
 * - 서명 불일치, 포맷 깨짐, issuer 불일치, 클레임 누락 등 토큰을 신뢰할 수 없을 때
 * - Filter/GlobalExceptionHandler에서 잡아서 401로 매핑
 *
 * 하위 타입(ExpiredTokenException, WrongTokenKindException)도 전부 "인증 실패"이므로
 * 구분이 필요 없는 호출부는 이 타입 하나만 잡으면 된다.
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}

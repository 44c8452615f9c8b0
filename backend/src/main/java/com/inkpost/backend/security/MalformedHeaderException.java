package com.inkpost.backend.security;

/**
 * Authorization 헤더(또는 Basic 페이로드) 형식이 깨진 경우
 * - scheme 불일치, "scheme token" 두 덩어리가 아님, base64 디코딩 실패, "email:password" 아님
 */
public class MalformedHeaderException extends RuntimeException {

    public MalformedHeaderException(String message) {
        super(message);
    }

    public MalformedHeaderException(String message, Throwable cause) {
        super(message, cause);
    }
}

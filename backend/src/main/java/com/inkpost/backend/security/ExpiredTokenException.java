package com.inkpost.backend.security;

/** 서명은 맞지만 exp가 현재 시각보다 과거인 토큰 */
public class ExpiredTokenException extends InvalidTokenException {

    public ExpiredTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}

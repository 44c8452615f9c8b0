package com.inkpost.backend.global;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * 비즈니스 로직에서 사용하는 커스텀 예외
 * - 서비스 어디서든 ErrorCode 하나만 넘기면
 *   HTTP 상태 코드 + 에러 코드 + 메시지가 함께 전달된다.
 * - GlobalExceptionHandler에서 이 예외 하나로 공통 처리
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;
    private final HttpStatus status;
    private final String code;
    private final Object details;

    public ApiException(ErrorCode errorCode) {
        this(errorCode, errorCode.defaultMessage(), null);
    }

    public ApiException(ErrorCode errorCode, String messageOverride) {
        this(errorCode, messageOverride, null);
    }

    public ApiException(ErrorCode errorCode, String messageOverride, Object details) {
        super(messageOverride);
        this.errorCode = errorCode;
        this.status = errorCode.status();
        this.code = errorCode.name();
        this.details = details;
    }
}

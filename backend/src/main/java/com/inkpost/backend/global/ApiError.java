package com.inkpost.backend.global;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 에러 응답 DTO
 * - 모든 에러 응답을 {code, message} 동일한 포맷으로 내려주기 위함
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String code, // 에러 식별 코드 (ErrorCode.name())
        String message, // 사용자에게 보여줄 에러 메세지
        Object details) {

    public static ApiError of(String code, String message) {
        return new ApiError(code, message, null);
    }

    public static ApiError of(ErrorCode errorCode) {
        return new ApiError(errorCode.name(), errorCode.defaultMessage(), null);
    }

    public static ApiError of(String code, String message, Object details) {
        return new ApiError(code, message, details);
    }
}

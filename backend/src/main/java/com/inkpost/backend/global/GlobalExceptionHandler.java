package com.inkpost.backend.global;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.inkpost.backend.security.ExpiredTokenException;
import com.inkpost.backend.security.InvalidTokenException;
import com.inkpost.backend.security.MalformedHeaderException;
import com.inkpost.backend.security.WrongTokenKindException;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;

/**
 * 전역 예외 처리기
 * - 컨트롤러/서비스에서 발생한 예외를 가로채
 * - HTTP 상태 코드 + ApiError 포맷으로 통일된 응답을 반환
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * ApiException 전용 핸들러
     * - 서비스/도메인 로직에서 의도적으로 던진 예외
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiError> handle(ApiException e) {
        return ResponseEntity
                .status(e.getStatus())
                .body(ApiError.of(e.getCode(), e.getMessage(), e.getDetails()));
    }

    /**
     * 토큰 예외 (재발급 엔드포인트에서 발생)
     * - 하위 타입이 더 구체적인 핸들러를 먼저 탄다.
     */
    @ExceptionHandler(ExpiredTokenException.class)
    public ResponseEntity<ApiError> handle(ExpiredTokenException e) {
        return error(ErrorCode.TOKEN_EXPIRED);
    }

    @ExceptionHandler(WrongTokenKindException.class)
    public ResponseEntity<ApiError> handle(WrongTokenKindException e) {
        return error(ErrorCode.TOKEN_KIND_MISMATCH);
    }

    @ExceptionHandler(InvalidTokenException.class)
    public ResponseEntity<ApiError> handle(InvalidTokenException e) {
        return error(ErrorCode.TOKEN_INVALID);
    }

    @ExceptionHandler(MalformedHeaderException.class)
    public ResponseEntity<ApiError> handle(MalformedHeaderException e) {
        return error(ErrorCode.MALFORMED_AUTH_HEADER);
    }

    /**
     * @RequestBody + @Valid 검증 실패 시 발생
     * - 클라이언트에는 상세 정보 노출 안 하고 서버 로그에만 필드/메시지 기록
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handle(MethodArgumentNotValidException e) {
        e.getBindingResult().getFieldErrors()
                .forEach(fe -> log.warn("Validation error: field={}, message={}",
                            fe.getField(),
                            fe.getDefaultMessage()));

        return error(ErrorCode.VALIDATION_ERROR);
    }

    /**
     * @RequestParam, @PathVariable, @ModelAttribute(쿼리 바인딩) 검증/변환 실패 + JSON 파싱 실패
     */
    @ExceptionHandler({
            BindException.class,
            ConstraintViolationException.class,
            HandlerMethodValidationException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ApiError> handleParameter(Exception e) {
        log.warn("Parameter validation error: {}", e.getMessage());
        return error(ErrorCode.VALIDATION_ERROR);
    }

    /**
     * 유니크 제약 위반 (동시 가입 등 서비스 단 중복 검사를 통과한 경쟁 상황)
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiError> handle(DataIntegrityViolationException e) {
        log.warn("Data integrity violation: {}", e.getMostSpecificCause().getMessage());
        return error(ErrorCode.DUPLICATE_RESOURCE);
    }

    /**
     * 매핑되지 않은 경로 (정적 리소스 핸들러까지 내려갔다가 못 찾은 경우 포함)
     */
    @ExceptionHandler({
            NoResourceFoundException.class,
            NoHandlerFoundException.class
    })
    public ResponseEntity<ApiError> handleNotFound(Exception e) {
        log.warn("No handler found: {}", e.getMessage());
        return error(ErrorCode.RESOURCE_NOT_FOUND);
    }

    /**
     * 경로는 있으나 메서드가 다름 (ex: PATCH /posts/{id})
     * - Allow 헤더는 Spring이 만들어 둔 값을 그대로 싣는다.
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiError> handle(HttpRequestMethodNotSupportedException e) {
        log.warn("Method not supported: {}", e.getMethod());
        return ResponseEntity
                .status(ErrorCode.METHOD_NOT_ALLOWED.status())
                .headers(e.getHeaders())
                .body(ApiError.of(ErrorCode.METHOD_NOT_ALLOWED));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiError> handle(HttpMediaTypeNotSupportedException e) {
        log.warn("Media type not supported: {}", e.getContentType());
        return ResponseEntity
                .status(ErrorCode.UNSUPPORTED_MEDIA_TYPE.status())
                .headers(e.getHeaders())
                .body(ApiError.of(ErrorCode.UNSUPPORTED_MEDIA_TYPE));
    }

    /**
     * 나머지
     * - 위에서 따로 잡지 않은 Spring MVC 표준 예외(ErrorResponse)는 자기 상태 코드를 그대로 쓴다.
     * - 그 외에는 500
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handle(Exception e) {
        if (e instanceof ErrorResponse errorResponse && errorResponse.getStatusCode().is4xxClientError()) {
            HttpStatusCode status = errorResponse.getStatusCode();
            log.warn("Request rejected: status={}, message={}", status.value(), e.getMessage());
            return ResponseEntity
                    .status(status)
                    .headers(errorResponse.getHeaders())
                    .body(ApiError.of(codeOf(status), messageOf(errorResponse)));
        }

        log.error("Unhandled exception", e);
        return error(ErrorCode.INTERNAL_ERROR);
    }

    private static String codeOf(HttpStatusCode status) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        return resolved != null ? resolved.name() : "HTTP_" + status.value();
    }

    private static String messageOf(ErrorResponse errorResponse) {
        String detail = errorResponse.getBody().getDetail();
        return detail != null ? detail : "요청을 처리할 수 없습니다.";
    }

    private static ResponseEntity<ApiError> error(ErrorCode errorCode) {
        return ResponseEntity
                .status(errorCode.status())
                .body(ApiError.of(errorCode));
    }
}

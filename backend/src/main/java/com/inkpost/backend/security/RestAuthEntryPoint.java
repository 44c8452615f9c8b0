package com.inkpost.backend.security;

import java.io.IOException;

import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import com.inkpost.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * "인증이 필요한 엔드포인트"에 인증 없이 접근했을 때 호출되는 EntryPoint.
 *
 * - Authorization 헤더가 없거나 Bearer 형식이 아니라서 인증이 비어있는 상태
 *
 * 반대로,
 * - Bearer 토큰이 있는데 invalid/만료/refresh 토큰이면 JwtAuthenticationFilter가 401을 직접 내려버린다.
 */
@RequiredArgsConstructor
public class RestAuthEntryPoint implements AuthenticationEntryPoint {

    private final SecurityErrorWriter errorWriter;

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException) throws IOException {

        errorWriter.write(response, ErrorCode.AUTH_REQUIRED);
    }
}

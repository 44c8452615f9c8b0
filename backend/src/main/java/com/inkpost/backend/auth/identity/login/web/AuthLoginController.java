package com.inkpost.backend.auth.identity.login.web;

import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.inkpost.backend.auth.identity.login.service.LoginService;
import com.inkpost.backend.auth.token.dto.TokenPair;
import com.inkpost.backend.security.AuthorizationHeaderParser;
import com.inkpost.backend.security.BasicCredential;

import lombok.RequiredArgsConstructor;

/**
 * 로그인 API 컨트롤러 (web 계층)
 *
 * - 자격 증명은 body가 아니라 Authorization: Basic base64(email:password) 헤더로 받는다.
 * - 헤더 파싱 -> LoginService 위임 -> 토큰 쌍을 body로 반환
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth/login")
public class AuthLoginController {

    private final AuthorizationHeaderParser headerParser;
    private final LoginService loginService;

    /**
     * POST /auth/login/email
     *
     * Response
     * - Body: { "accessToken": "...", "refreshToken": "..." }
     */
    @PostMapping("/email")
    public TokenPair loginWithEmail(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization
    ) {
        String payload = headerParser.extractToken(authorization, false);
        BasicCredential credential = headerParser.decodeBasicCredential(payload);
        return loginService.login(credential);
    }
}

package com.inkpost.backend.auth.token.web;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.inkpost.backend.auth.token.dto.AccessTokenResponse;
import com.inkpost.backend.auth.token.dto.RefreshTokenResponse;
import com.inkpost.backend.auth.token.service.TokenRotationService;
import com.inkpost.backend.security.AuthorizationHeaderParser;

import lombok.RequiredArgsConstructor;

/**
 * 토큰 재발급 API
 * - Authorization: Bearer <refreshToken>
 * - JwtAuthenticationFilter를 타지 않는다. (Bearer 자리에 refresh 토큰이 오기 때문)
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth/token")
public class AuthTokenController {

    private final AuthorizationHeaderParser headerParser;
    private final TokenRotationService tokenRotationService;

    // POST: /auth/token/access
    @PostMapping("/access")
    @ResponseStatus(HttpStatus.CREATED)
    public AccessTokenResponse reissueAccess(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization
    ) {
        String refresh = headerParser.extractToken(authorization, true);
        return new AccessTokenResponse(tokenRotationService.rotate(refresh, false));
    }

    // POST: /auth/token/refresh
    @PostMapping("/refresh")
    @ResponseStatus(HttpStatus.CREATED)
    public RefreshTokenResponse reissueRefresh(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization
    ) {
        String refresh = headerParser.extractToken(authorization, true);
        return new RefreshTokenResponse(tokenRotationService.rotate(refresh, true));
    }
}

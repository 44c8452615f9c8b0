package com.inkpost.backend.security;

import java.io.IOException;
import java.util.List;

import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import com.inkpost.backend.global.ErrorCode;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Security Filter Chain에서 동작하는 JWT 인증 필터
 *
 * - Authorization: Bearer <token> 헤더가 있으면 토큰을 꺼낸다.
 * - JwtService.verifyAccessToken으로 검증해서 AuthPrincipal(userId, email)을 얻는다. (refresh 토큰은 거절)
 * - Authentication 객체를 만들어 SecurityContext에 넣고 다음 필터/컨트롤러로 넘긴다.
 *
 * 주의:
 * - "Bearer 토큰이 없는 요청"은 여기서 막지 않는다. (막는 건 SecurityConfig의 authorize 규칙과 EntryPoint)
 * - "Bearer 토큰이 있는데 invalid"면 여기서 401 ACCESS_INVALID를 직접 내려준다.
 * - /auth/token/** 은 Bearer 자리에 refresh 토큰이 오고, /auth/login/** 은 Basic 헤더를 직접 파싱하므로
 *   auth 공개 엔드포인트(가입/로그인/재발급)는 이 필터를 타지 않는다.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final List<String> SKIP_PATH_PREFIXES = List.of(
            "/auth/register/",
            "/auth/login/",
            "/auth/token/"
    );

    private final JwtService jwtService;
    private final AuthorizationHeaderParser headerParser;
    private final SecurityErrorWriter errorWriter;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return SKIP_PATH_PREFIXES.stream().anyMatch(path::startsWith);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        // 이미 앞단에서 인증이 되어 있으면 그냥 패스
        if (SecurityContextHolder.getContext().getAuthentication() != null) {
            filterChain.doFilter(request, response);
            return;
        }

        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (!isBearer(authHeader)) {
            // 헤더가 없거나 Basic 등 다른 scheme -> 인증 없이 통과 (보호 리소스면 EntryPoint가 401)
            filterChain.doFilter(request, response);
            return;
        }

        AuthPrincipal principal;
        try {
            String token = headerParser.extractToken(authHeader, true);
            principal = jwtService.verifyAccessToken(token);
        } catch (InvalidTokenException | MalformedHeaderException ex) {
            // 만료/서명 불량/refresh 토큰 모두 같은 401로 뭉갠다
            log.debug("Rejected bearer token: {}", ex.getMessage());
            SecurityContextHolder.clearContext();
            errorWriter.write(response, ErrorCode.ACCESS_INVALID);
            return;
        }

        // 권한 모델이 없으므로 authorities는 비워둔다 (3-arg 생성자 = authenticated)
        var authentication = new UsernamePasswordAuthenticationToken(principal, null, List.of());
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        filterChain.doFilter(request, response);
    }

    private static boolean isBearer(String authHeader) {
        return authHeader != null && authHeader.startsWith(AuthorizationHeaderParser.BEARER + " ");
    }
}

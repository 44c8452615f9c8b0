package com.inkpost.backend.security;

/**
 * 인증 완료 후 SecurityContext에 올릴 "로그인 사용자 정보" 모델
 *
 * JwtAuthenticationFilter에서 access 토큰 검증 성공 시 이 AuthPrincipal을 만들어 Authentication에 넣고,
 * 컨트롤러는 @AuthenticationPrincipal AuthPrincipal 파라미터로 꺼내 쓴다.
 */
public record AuthPrincipal(Long userId, String email) {}

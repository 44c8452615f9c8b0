package com.inkpost.backend.auth.token.dto;

/**
 * 가입/로그인 응답: access + refresh 한 쌍
 * - 둘 다 JSON body로 내려간다. (쿠키 없음)
 */
public record TokenPair(String accessToken, String refreshToken) {}

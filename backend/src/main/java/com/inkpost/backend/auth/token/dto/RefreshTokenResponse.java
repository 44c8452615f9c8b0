package com.inkpost.backend.auth.token.dto;

public record RefreshTokenResponse(String refreshToken) {}

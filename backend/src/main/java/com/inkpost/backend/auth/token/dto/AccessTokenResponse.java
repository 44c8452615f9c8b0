package com.inkpost.backend.auth.token.dto;

public record AccessTokenResponse(String accessToken) {}

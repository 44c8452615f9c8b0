package com.inkpost.backend.auth.identity.me.dto;

public record MeResponse(
        Long userId,
        String email,
        String nickname
) {}

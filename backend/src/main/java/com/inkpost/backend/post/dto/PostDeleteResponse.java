package com.inkpost.backend.post.dto;

public record PostDeleteResponse(Long id) {}

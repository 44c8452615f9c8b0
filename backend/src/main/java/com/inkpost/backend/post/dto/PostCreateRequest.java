package com.inkpost.backend.post.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PostCreateRequest(
        @NotBlank @Size(max = 255)
        String title,

        @NotBlank @Size(max = 5000)
        String content
) {}

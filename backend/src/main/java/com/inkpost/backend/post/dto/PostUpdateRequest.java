package com.inkpost.backend.post.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * 부분 수정: 보내지 않은(null) 필드는 바뀌지 않는다.
 * 보낸 필드는 공백만으로 채울 수 없다.
 */
public record PostUpdateRequest(
        @Size(max = 255) @Pattern(regexp = "(?s).*\\S.*")
        String title,

        @Size(max = 5000) @Pattern(regexp = "(?s).*\\S.*")
        String content
) {}

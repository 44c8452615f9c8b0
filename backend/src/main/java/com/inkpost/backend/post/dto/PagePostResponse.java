package com.inkpost.backend.post.dto;

import java.util.List;

public record PagePostResponse(
        List<PostResponse> data,
        long total
) implements PostPageResponse {}

package com.inkpost.backend.post.dto;

import java.util.List;

/**
 * 커서 기반 응답
 * - 가져온 개수가 take 와 같을 때만 cursor.after / next 가 채워진다. (아니면 null = 마지막 페이지)
 */
public record CursorPostResponse(
        List<PostResponse> data,
        Cursor cursor,
        int count,
        String next
) implements PostPageResponse {

    public record Cursor(Long after) {}
}

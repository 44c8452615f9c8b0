package com.inkpost.backend.post.dto;

import java.util.List;

/**
 * GET /posts 응답 (페이지 기반 | 커서 기반)
 */
public interface PostPageResponse {

    List<PostResponse> data();
}

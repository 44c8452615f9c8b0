package com.inkpost.backend.post.web;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import com.inkpost.backend.global.ApiException;
import com.inkpost.backend.global.ErrorCode;
import com.inkpost.backend.post.dto.PostCreateRequest;
import com.inkpost.backend.post.dto.PostDeleteResponse;
import com.inkpost.backend.post.dto.PostPageResponse;
import com.inkpost.backend.post.dto.PostPaginateRequest;
import com.inkpost.backend.post.dto.PostResponse;
import com.inkpost.backend.post.dto.PostUpdateRequest;
import com.inkpost.backend.post.service.PostService;
import com.inkpost.backend.security.AuthPrincipal;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 게시글 API
 * - GET 은 비로그인 허용, 나머지는 Bearer access 토큰 필요 (SecurityConfig)
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/posts")
public class PostController {

    private final PostService postService;

    // GET /posts?page=1&take=20  |  GET /posts?where__id_more_than=10&order__createdAt=ASC
    @GetMapping
    public PostPageResponse getPosts(@Valid @ModelAttribute PostPaginateRequest req) {
        return postService.paginate(req, ServletUriComponentsBuilder.fromCurrentRequest());
    }

    @GetMapping("/{id}")
    public PostResponse getPost(@PathVariable Long id) {
        return postService.getPost(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public PostResponse createPost(
            @AuthenticationPrincipal AuthPrincipal principal,
            @Valid @RequestBody PostCreateRequest req
    ) {
        return postService.createPost(requireUserId(principal), req.title(), req.content());
    }

    @PutMapping("/{id}")
    public PostResponse updatePost(@PathVariable Long id, @Valid @RequestBody PostUpdateRequest req) {
        return postService.updatePost(id, req.title(), req.content());
    }

    @DeleteMapping("/{id}")
    public PostDeleteResponse deletePost(@PathVariable Long id) {
        return new PostDeleteResponse(postService.deletePost(id));
    }

    private static Long requireUserId(AuthPrincipal principal) {
        if (principal == null || principal.userId() == null) {
            throw new ApiException(ErrorCode.AUTH_REQUIRED);
        }
        return principal.userId();
    }
}

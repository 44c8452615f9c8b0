package com.inkpost.backend.post.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.util.UriComponentsBuilder;

import com.inkpost.backend.auth.domain.User;
import com.inkpost.backend.auth.repo.UserRepository;
import com.inkpost.backend.global.ApiException;
import com.inkpost.backend.global.ErrorCode;
import com.inkpost.backend.post.domain.Post;
import com.inkpost.backend.post.dto.CursorPostResponse;
import com.inkpost.backend.post.dto.PagePostResponse;
import com.inkpost.backend.post.dto.PostPageResponse;
import com.inkpost.backend.post.dto.PostPaginateRequest;
import com.inkpost.backend.post.dto.PostResponse;
import com.inkpost.backend.post.repo.PostRepository;
import com.inkpost.backend.post.repo.PostSpecifications;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 게시글 CRUD + 목록 페이징
 * - 권한 모델이 없으므로 수정/삭제는 로그인한 누구나 가능하다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PostService {

    static final String MORE_THAN_PARAM = "where__id_more_than";
    static final String LESS_THAN_PARAM = "where__id_less_than";

    private final PostRepository postRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public PostResponse getPost(Long id) {
        return PostResponse.from(findPost(id));
    }

    @Transactional
    public PostResponse createPost(Long authorId, String title, String content) {
        User author = userRepository.findById(authorId)
                .orElseThrow(() -> new ApiException(ErrorCode.USER_NOT_FOUND));

        Post saved = postRepository.save(Post.create(author, title, content, LocalDateTime.now(clock)));

        log.info("Post created: postId={}, authorId={}", saved.getId(), authorId);
        return PostResponse.from(saved);
    }

    @Transactional
    public PostResponse updatePost(Long id, String title, String content) {
        Post post = findPost(id);
        post.update(title, content, LocalDateTime.now(clock));
        return PostResponse.from(post);
    }

    @Transactional
    public Long deletePost(Long id) {
        Post post = postRepository.findById(id)
                .orElseThrow(() -> new ApiException(ErrorCode.POST_NOT_FOUND));
        postRepository.delete(post);

        log.info("Post deleted: postId={}", id);
        return id;
    }

    /**
     * 목록 조회
     * @param currentUri 현재 요청 URL (커서 모드의 next 링크 생성용)
     */
    @Transactional(readOnly = true)
    public PostPageResponse paginate(PostPaginateRequest req, UriComponentsBuilder currentUri) {
        Sort sort = Sort.by(req.orderCreatedAt(), "createdAt")
                .and(Sort.by(req.orderCreatedAt(), "id"));

        return req.isPageMode()
                ? pagePaginate(req, sort)
                : cursorPaginate(req, sort, currentUri);
    }

    private PagePostResponse pagePaginate(PostPaginateRequest req, Sort sort) {
        Page<Post> page = postRepository.findAll(
                (Specification<Post>) null,
                PageRequest.of(req.page() - 1, req.take(), sort));

        return new PagePostResponse(toResponses(page.getContent()), page.getTotalElements());
    }

    private CursorPostResponse cursorPaginate(PostPaginateRequest req, Sort sort, UriComponentsBuilder currentUri) {
        Specification<Post> spec = Specification.where(PostSpecifications.idGreaterThan(req.idMoreThan()))
                .and(PostSpecifications.idLessThan(req.idLessThan()));

        List<Post> posts = postRepository.findAll(spec, PageRequest.of(0, req.take(), sort)).getContent();

        // take만큼 꽉 찼을 때만 다음 페이지가 있다고 본다
        Post last = posts.size() == req.take() ? posts.get(posts.size() - 1) : null;

        Long after = last == null ? null : last.getId();
        String next = last == null ? null : nextUrl(currentUri, req.orderCreatedAt(), after);

        return new CursorPostResponse(
                toResponses(posts),
                new CursorPostResponse.Cursor(after),
                posts.size(),
                next);
    }

    // 기존 커서 파라미터를 지우고 정렬 방향에 맞는 커서 하나만 다시 붙인다
    private static String nextUrl(UriComponentsBuilder currentUri, Sort.Direction direction, Long after) {
        String cursorParam = direction == Sort.Direction.ASC ? MORE_THAN_PARAM : LESS_THAN_PARAM;

        return currentUri.cloneBuilder()
                .replaceQueryParam(MORE_THAN_PARAM)
                .replaceQueryParam(LESS_THAN_PARAM)
                .replaceQueryParam(cursorParam, after)
                .build()
                .toUriString();
    }

    private Post findPost(Long id) {
        return postRepository.findWithAuthorById(id)
                .orElseThrow(() -> new ApiException(ErrorCode.POST_NOT_FOUND));
    }

    private static List<PostResponse> toResponses(List<Post> posts) {
        return posts.stream().map(PostResponse::from).toList();
    }
}

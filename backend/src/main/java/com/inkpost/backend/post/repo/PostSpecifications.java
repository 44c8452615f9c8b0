package com.inkpost.backend.post.repo;

import org.springframework.data.jpa.domain.Specification;

import com.inkpost.backend.post.domain.Post;

/**
 * 커서 조건: 값이 null이면 조건 없음(null Specification)
 */
public final class PostSpecifications {

    private PostSpecifications() {
    }

    public static Specification<Post> idGreaterThan(Long id) {
        return id == null ? null : (root, query, cb) -> cb.greaterThan(root.get("id"), id);
    }

    public static Specification<Post> idLessThan(Long id) {
        return id == null ? null : (root, query, cb) -> cb.lessThan(root.get("id"), id);
    }
}

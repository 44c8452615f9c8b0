package com.inkpost.backend.post.dto;

import java.time.LocalDateTime;

import com.inkpost.backend.auth.domain.User;
import com.inkpost.backend.post.domain.Post;

public record PostResponse(
        Long id,
        Author author,
        String title,
        String content,
        int likeCount,
        int commentCount,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    public record Author(Long id, String email, String nickname) {

        static Author from(User user) {
            return new Author(user.getId(), user.getEmail(), user.getNickname());
        }
    }

    public static PostResponse from(Post post) {
        return new PostResponse(
                post.getId(),
                Author.from(post.getAuthor()),
                post.getTitle(),
                post.getContent(),
                post.getLikeCount(),
                post.getCommentCount(),
                post.getCreatedAt(),
                post.getUpdatedAt()
        );
    }
}

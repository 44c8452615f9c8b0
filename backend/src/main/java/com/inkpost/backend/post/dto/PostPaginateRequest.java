package com.inkpost.backend.post.dto;

import org.springframework.data.domain.Sort;
import org.springframework.web.bind.annotation.BindParam;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * GET /posts 쿼리 파라미터
 *
 * - page 가 있으면 페이지 기반, 없으면 커서 기반
 * - where__id_more_than / where__id_less_than : 커서 조건 (id 기준)
 * - order__createdAt : ASC(기본) | DESC
 * - take : 한 번에 가져올 개수 (기본 20, 최대 100)
 * - page 상한: (page - 1) * take 오프셋이 int 범위를 넘지 않아야 한다. (JPA setFirstResult가 int)
 */
public record PostPaginateRequest(
        @Min(1) @Max(PostPaginateRequest.MAX_PAGE)
        Integer page,

        @BindParam("where__id_more_than")
        Long idMoreThan,

        @BindParam("where__id_less_than")
        Long idLessThan,

        @BindParam("order__createdAt")
        Sort.Direction orderCreatedAt,

        @Min(1) @Max(PostPaginateRequest.MAX_TAKE)
        Integer take
) {

    public static final int DEFAULT_TAKE = 20;
    public static final int MAX_TAKE = 100;
    public static final int MAX_PAGE = Integer.MAX_VALUE / MAX_TAKE + 1;

    public PostPaginateRequest {
        if (orderCreatedAt == null) {
            orderCreatedAt = Sort.Direction.ASC;
        }
        if (take == null) {
            take = DEFAULT_TAKE;
        }
    }

    public boolean isPageMode() {
        return page != null;
    }
}

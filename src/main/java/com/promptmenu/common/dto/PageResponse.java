package com.promptmenu.common.dto;

import org.springframework.data.domain.Page;

import java.util.List;

/**
 * 페이지 조회 응답. page는 1부터 시작한다.
 *
 * @param items      현재 페이지의 문서
 * @param count      현재 페이지 문서 수
 * @param totalCount 조건에 맞는 전체 문서 수
 * @param page       요청한 페이지 (1-based)
 * @param totalPages 전체 페이지 수
 */
public record PageResponse<T>(
        List<T> items,
        int count,
        long totalCount,
        int page,
        int totalPages
) {

    public static <T> PageResponse<T> from(Page<T> page) {
        return new PageResponse<>(
                page.getContent(),
                page.getNumberOfElements(),
                page.getTotalElements(),
                page.getNumber() + 1,
                page.getTotalPages());
    }
}

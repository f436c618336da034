package com.promptmenu.common.util;

import com.promptmenu.common.exception.BusinessException;
import com.promptmenu.common.exception.ErrorCode;

/**
 * 목록 조회 페이지 파라미터 검증. page는 1부터, limit은 1~100.
 */
public final class Paging {

    public static final String DEFAULT_PAGE = "1";
    public static final String DEFAULT_LIMIT = "10";
    public static final int MAX_LIMIT = 100;

    private Paging() {
    }

    public static void validate(int page, int limit) {
        if (page < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "page must be at least 1");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "limit must be between 1 and " + MAX_LIMIT);
        }
    }
}

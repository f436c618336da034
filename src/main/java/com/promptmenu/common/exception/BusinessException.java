package com.promptmenu.common.exception;

import lombok.Getter;

/**
 * 비즈니스 예외 - {@link ErrorCode} 기반으로 표준화된 예외.
 *
 * <p>{@code BusinessException(ErrorCode)}는 기본 메시지를, {@code BusinessException(ErrorCode, String)}은
 * "Order #ORD-20250101120000 not found"처럼 상세 메시지를 사용한다.</p>
 */
@Getter
public class BusinessException extends RuntimeException {
    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }
}

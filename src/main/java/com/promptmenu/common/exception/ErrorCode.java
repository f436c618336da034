package com.promptmenu.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 에러 코드 열거형 - HTTP 상태 코드와 기본 에러 메시지를 한 곳에서 관리한다.
 *
 * <p>서비스 계층은 {@link BusinessException}에 이 값을 담아 던지고,
 * {@link GlobalExceptionHandler}가 상태 코드와 {@code {"error": ...}} 본문으로 변환한다.</p>
 *
 * <ul>
 *   <li>400: 필드 누락, 잘못된 값, 잘못된 ID 형식</li>
 *   <li>401 / 403: 인증 실패 / 권한 없음</li>
 *   <li>404: 참조한 문서 없음</li>
 *   <li>409: 낙관적 락 충돌 (동시 수정), 번호 중복</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),
    INVALID_JSON(HttpStatus.BAD_REQUEST, "Invalid request body. Please provide valid JSON."),
    INVALID_ID_FORMAT(HttpStatus.BAD_REQUEST, "Invalid ID format"),
    CONCURRENT_MODIFICATION(HttpStatus.CONFLICT, "Concurrent modification, please retry"),
    DUPLICATE_NUMBER(HttpStatus.CONFLICT, "Order or review number already exists"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"),

    // Auth
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, "Authentication required"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "Unauthorized"),

    // Restaurant
    RESTAURANT_NOT_FOUND(HttpStatus.NOT_FOUND, "Restaurant not found"),

    // Order
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Order not found"),
    INVALID_ORDER_STATUS(HttpStatus.BAD_REQUEST, "Invalid status"),

    // Review
    REVIEW_NOT_FOUND(HttpStatus.NOT_FOUND, "Review not found"),
    INVALID_RATING(HttpStatus.BAD_REQUEST, "Rating must be between 1 and 5"),
    INVALID_REVIEW_STATUS(HttpStatus.BAD_REQUEST, "Invalid status"),
    REVIEW_NOT_PUBLISHED(HttpStatus.BAD_REQUEST, "Only published reviews can be featured");

    private final HttpStatus status;
    private final String message;
}

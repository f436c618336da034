package com.promptmenu.common.security;

import com.promptmenu.common.exception.BusinessException;
import com.promptmenu.common.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 인증 인터셉터 - 모든 /api/** 요청에 한 번만 적용되는 Bearer 토큰 검증.
 *
 * <p>Authorization 헤더에서 토큰을 꺼내 {@link IdentityVerifier}로 검증하고,
 * 결과({@link CallerIdentity})를 요청 속성에 저장한다. 헤더가 없거나 형식이 틀리거나
 * 토큰이 유효하지 않으면 컨트롤러에 도달하기 전에 401로 끝난다.</p>
 *
 * <p>preHandle에서 던진 예외도 {@code @RestControllerAdvice}가 처리하므로
 * 응답 형식({"error": ...})이 다른 에러와 같다.</p>
 */
@RequiredArgsConstructor
public class AuthenticationInterceptor implements HandlerInterceptor {

    private static final String BEARER_PREFIX = "Bearer ";

    private final IdentityVerifier identityVerifier;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String token = resolveToken(request);
        CallerIdentity caller = identityVerifier.verify(token);
        request.setAttribute(CallerIdentity.ATTRIBUTE, caller);
        return true;
    }

    private String resolveToken(HttpServletRequest request) {
        String header = request.getHeader("Authorization");
        if (!StringUtils.hasText(header)) {
            throw new BusinessException(ErrorCode.UNAUTHENTICATED, "Authorization header is missing");
        }
        if (!header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())
                || !StringUtils.hasText(header.substring(BEARER_PREFIX.length()))) {
            throw new BusinessException(ErrorCode.UNAUTHENTICATED,
                    "Invalid authorization format. Expected 'Bearer {token}'");
        }
        return header.substring(BEARER_PREFIX.length()).trim();
    }
}

package com.promptmenu.common.security;

/**
 * Bearer 자격 증명을 검증하고 호출자 정보를 돌려주는 외부 협력자.
 *
 * <p>검증에 실패하면 {@code ErrorCode.UNAUTHENTICATED}를 담은 BusinessException을 던진다.</p>
 */
public interface IdentityVerifier {

    CallerIdentity verify(String bearerToken);
}

package com.promptmenu.common.security;

import java.util.List;

/**
 * 인증된 호출자 정보. {@link AuthenticationInterceptor}가 요청 속성에 저장하고
 * 컨트롤러는 {@code @RequestAttribute(CallerIdentity.ATTRIBUTE)}로 꺼내 쓴다.
 *
 * @param subjectId         토큰의 subject (customer_id, owner_id와 비교되는 값)
 * @param preferredUsername 감사 필드(created_by, updated_by 등)에 기록되는 이름
 * @param roles             역할 목록. "admin" 포함 여부로 관리자 권한을 판단한다.
 */
public record CallerIdentity(String subjectId, String preferredUsername, List<String> roles) {

    public static final String ATTRIBUTE = "callerIdentity";
    public static final String ADMIN_ROLE = "admin";

    public CallerIdentity {
        roles = roles == null ? List.of() : List.copyOf(roles);
        if (preferredUsername == null || preferredUsername.isBlank()) {
            preferredUsername = "unknown";
        }
    }

    public boolean isAdmin() {
        return roles.contains(ADMIN_ROLE);
    }

    public boolean isSubject(String ownerId) {
        return subjectId != null && !subjectId.isEmpty() && subjectId.equals(ownerId);
    }
}

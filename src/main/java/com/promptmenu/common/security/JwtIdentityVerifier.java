package com.promptmenu.common.security;

import com.promptmenu.common.exception.BusinessException;
import com.promptmenu.common.exception.ErrorCode;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * JWT 기반 {@link IdentityVerifier} 구현.
 *
 * <p>HMAC-SHA 대칭 키로 서명을 검증하고 {@code sub}, {@code preferred_username}, {@code roles}
 * 클레임을 {@link CallerIdentity}로 변환한다. 만료, 변조, 형식 오류는 모두 401로 처리된다.</p>
 *
 * <p>토큰 발급은 외부 인증 서버의 책임이며 이 서비스는 검증만 한다.
 * secret은 application.yml(jwt.secret)에서 주입받는다. 기본값은 개발 환경용이며
 * 운영 환경에서는 JWT_SECRET 환경 변수로 덮어써야 한다.</p>
 */
@Component
public class JwtIdentityVerifier implements IdentityVerifier {

    static final String USERNAME_CLAIM = "preferred_username";
    static final String ROLES_CLAIM = "roles";

    private final SecretKey key;

    public JwtIdentityVerifier(
            @Value("${jwt.secret:promptMenuDevelopmentSecretKeyThatIsLongEnough}") String secret) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public CallerIdentity verify(String bearerToken) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(bearerToken)
                    .getPayload();
            return new CallerIdentity(
                    claims.getSubject(),
                    claims.get(USERNAME_CLAIM, String.class),
                    readRoles(claims));
        } catch (ExpiredJwtException e) {
            throw new BusinessException(ErrorCode.UNAUTHENTICATED, "Token has expired");
        } catch (JwtException | IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.UNAUTHENTICATED, "Invalid token: " + e.getMessage());
        }
    }

    private List<String> readRoles(Claims claims) {
        Object roles = claims.get(ROLES_CLAIM);
        if (roles instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}

package com.promptmenu.common.config;

import com.promptmenu.common.security.AuthenticationInterceptor;
import com.promptmenu.common.security.IdentityVerifier;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * 인증 인터셉터 등록. 모든 엔드포인트가 같은 인증 경로를 거친다.
 */
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final IdentityVerifier identityVerifier;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new AuthenticationInterceptor(identityVerifier))
                .addPathPatterns("/api/**");
    }
}

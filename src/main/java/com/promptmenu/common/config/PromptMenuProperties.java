package com.promptmenu.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * promptmenu.* 설정.
 *
 * <pre>
 * promptmenu:
 *   review:
 *     flag-threshold: 5     # flag_count가 이 값 이상이면 published → under_review
 *   mongo:
 *     timeout: 30s          # connect/socket timeout
 * </pre>
 */
@ConfigurationProperties(prefix = "promptmenu")
public record PromptMenuProperties(
        @DefaultValue Review review,
        @DefaultValue Mongo mongo
) {

    public record Review(@DefaultValue("5") int flagThreshold) {
    }

    public record Mongo(@DefaultValue("30s") Duration timeout) {
    }
}

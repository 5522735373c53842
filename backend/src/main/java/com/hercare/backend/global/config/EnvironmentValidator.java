package com.hercare.backend.global.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 시작 시 필수 설정값 검증.
 * The {@code test} profile is exempt because Testcontainers supplies the datasource at runtime.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEFAULT_DEV_SECRET = "hercare-dev-jwt-secret-change-me-in-production-2026";

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        if (Arrays.asList(environment.getActiveProfiles()).contains("test")) {
            return;
        }

        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration check failed: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration check passed");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            String value = environment.getProperty(key);
            if (value == null || value.isBlank()) {
                problems.add("missing " + key);
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(DEFAULT_DEV_SECRET::equals)
                .filter(secret -> !Arrays.asList(environment.getActiveProfiles()).contains("local"))
                .ifPresent(secret -> problems.add("jwt.secret still uses the development default"));

        String expiration = environment.getProperty("jwt.expiration");
        if (expiration != null && !expiration.isBlank()) {
            try {
                long millis = Long.parseLong(expiration.trim());
                if (millis < 300_000L || millis > 86_400_000L) { // 5분 ~ 24시간
                    problems.add("jwt.expiration must be between 300000 and 86400000 ms");
                }
            } catch (NumberFormatException ex) {
                problems.add("jwt.expiration must be numeric");
            }
        }
        return problems;
    }
}

package com.hercare.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private static MockEnvironment completeEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://db:5432/hercare")
                .withProperty("jwt.secret", "a-production-secret-that-is-long-enough")
                .withProperty("jwt.expiration", "3600000")
                .withProperty("app.cors.allowed-origins", "https://hercare.app");
    }

    @Test
    void completeConfigurationPasses() {
        assertThat(new EnvironmentValidator(completeEnvironment()).collectProblems()).isEmpty();
    }

    @Test
    void developmentSecretOnlyAllowedLocally() {
        MockEnvironment environment = completeEnvironment()
                .withProperty("jwt.secret", EnvironmentValidator.DEFAULT_DEV_SECRET);

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactly("jwt.secret still uses the development default");

        environment.setActiveProfiles("local");
        assertThat(new EnvironmentValidator(environment).collectProblems()).isEmpty();
    }

    @Test
    void expirationOutsideBoundsIsReported() {
        MockEnvironment environment = completeEnvironment().withProperty("jwt.expiration", "1000");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactly("jwt.expiration must be between 300000 and 86400000 ms");
    }

    @Test
    void missingKeysFailStartup() {
        MockEnvironment environment = new MockEnvironment().withProperty("jwt.expiration", "3600000");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("missing spring.datasource.url")
                .hasMessageContaining("missing jwt.secret");
    }
}

package com.sentidash.backend.global.config;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    @Test
    void completeConfigurationPasses() {
        assertThatCode(() -> new EnvironmentValidator(validEnvironment()).validateEnvironment())
                .doesNotThrowAnyException();
    }

    @Test
    void defaultSecretIsRejected() {
        MockEnvironment environment = validEnvironment().withProperty("jwt.secret", EnvironmentValidator.DEFAULT_SECRET);

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void missingAudienceIsRejected() {
        MockEnvironment environment = validEnvironment().withProperty("auth.jwt.audience", " ");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("auth.jwt.audience");
    }

    @Test
    void accessTokenLifetimeOutsideRangeIsRejected() {
        MockEnvironment environment = validEnvironment().withProperty("jwt.expiration", "7200000");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class);
    }

    private MockEnvironment validEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost/test")
                .withProperty("jwt.secret", "a-sufficiently-long-random-secret-value-42")
                .withProperty("jwt.expiration", "900000")
                .withProperty("auth.jwt.issuer", "https://auth.test")
                .withProperty("auth.jwt.audience", "api-test")
                .withProperty("auth.magic-link.link-base-url", "https://app.test/verify");
    }
}

package com.harvey.backend.controller;

import com.harvey.backend.exception.UnauthorizedException;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdminTokenGuardTest {

    @Test
    void matchingTokenPasses() {
        AdminTokenGuard guard = new AdminTokenGuard(new MockEnvironment(), "secret");

        assertThatCode(() -> guard.requireAdmin("secret")).doesNotThrowAnyException();
    }

    @Test
    void missingOrWrongTokenIsRejected() {
        AdminTokenGuard guard = new AdminTokenGuard(new MockEnvironment(), "secret");

        assertThatThrownBy(() -> guard.requireAdmin(null)).isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> guard.requireAdmin("guess")).isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void blankConfiguredTokenRejectsEverything() {
        AdminTokenGuard guard = new AdminTokenGuard(new MockEnvironment(), "");

        assertThatThrownBy(() -> guard.requireAdmin("")).isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void localProfileSkipsTheCheck() {
        MockEnvironment environment = new MockEnvironment();
        environment.setActiveProfiles("local");
        AdminTokenGuard guard = new AdminTokenGuard(environment, "");

        assertThatCode(() -> guard.requireAdmin(null)).doesNotThrowAnyException();
    }
}

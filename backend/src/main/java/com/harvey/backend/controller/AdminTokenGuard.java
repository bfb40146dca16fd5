package com.harvey.backend.controller;

import com.harvey.backend.exception.UnauthorizedException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Gate for mutating endpoints. The dev and local profiles skip the token check.
 */
@Component
public class AdminTokenGuard {

    public static final String HEADER = "X-Admin-Token";

    private final Environment environment;
    private final String adminToken;

    public AdminTokenGuard(Environment environment, @Value("${harvey.admin.token:}") String adminToken) {
        this.environment = environment;
        this.adminToken = adminToken;
    }

    public void requireAdmin(String token) {
        boolean authorized = isDevProfile()
                || (adminToken != null && !adminToken.isBlank() && adminToken.equals(token));
        if (!authorized) {
            throw new UnauthorizedException("Admin token required");
        }
    }

    private boolean isDevProfile() {
        for (String profile : environment.getActiveProfiles()) {
            if ("dev".equalsIgnoreCase(profile) || "local".equalsIgnoreCase(profile)) {
                return true;
            }
        }
        return false;
    }
}

package com.hercare.backend.global.security;

import java.util.List;
import java.util.UUID;

public record JwtAuthenticationPrincipal(
        UUID userId,
        String email,
        List<String> roles
) {
    public boolean hasRole(String roleCode) {
        return roles != null && roles.contains(roleCode);
    }
}

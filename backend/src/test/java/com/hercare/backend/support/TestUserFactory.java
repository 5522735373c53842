package com.hercare.backend.support;

import java.util.List;
import java.util.UUID;

import com.hercare.backend.modules.auth.application.IdentityService;
import com.hercare.backend.modules.auth.application.IdentityService.NewIdentity;
import com.hercare.backend.modules.auth.application.JwtTokenService;
import com.hercare.backend.modules.auth.domain.HercareUser;
import com.hercare.backend.modules.auth.domain.UserRole;

import org.springframework.stereotype.Component;

/**
 * Creates registered accounts with unique emails and hands out bearer headers for them.
 */
@Component
public class TestUserFactory {

    public static final String DEFAULT_PASSWORD = "password1!";

    private final IdentityService identityService;
    private final JwtTokenService jwtTokenService;

    public TestUserFactory(IdentityService identityService, JwtTokenService jwtTokenService) {
        this.identityService = identityService;
        this.jwtTokenService = jwtTokenService;
    }

    public TestAccount patient(String name) {
        return create(name, UserRole.PATIENT);
    }

    public TestAccount doctor(String name) {
        return create(name, UserRole.DOCTOR);
    }

    public String bearer(HercareUser user) {
        String token = jwtTokenService.issueAccessToken(user.getId(), user.getEmail(), List.of(user.getRole().name()))
                .accessToken();
        return "Bearer " + token;
    }

    private TestAccount create(String name, UserRole role) {
        String email = name.toLowerCase().replaceAll("[^a-z0-9]", "") + "-" + UUID.randomUUID() + "@example.com";
        HercareUser user = identityService.create(new NewIdentity(name, role, email, DEFAULT_PASSWORD, null, null));
        return new TestAccount(user.getId(), email, bearer(user));
    }

    public record TestAccount(UUID id, String email, String authorization) {
    }
}

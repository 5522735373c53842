package com.hercare.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

public record AccessTokenResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        OffsetDateTime issuedAt
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";
}

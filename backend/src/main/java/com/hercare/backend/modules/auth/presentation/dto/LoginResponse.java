package com.hercare.backend.modules.auth.presentation.dto;

public record LoginResponse(
        AccessTokenResponse tokens,
        UserProfileResponse user
) {
}

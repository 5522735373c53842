package com.hercare.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.hercare.backend.modules.auth.domain.HercareUser;
import com.hercare.backend.modules.auth.domain.UserRole;

public record UserProfileResponse(
        UUID userId,
        String name,
        String email,
        UserRole role,
        Integer age,
        String phone,
        boolean shadow,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
    public static UserProfileResponse from(HercareUser user) {
        return new UserProfileResponse(
                user.getId(),
                user.getName(),
                user.getEmail(),
                user.getRole(),
                user.getAge(),
                user.getPhone(),
                user.isShadow(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}

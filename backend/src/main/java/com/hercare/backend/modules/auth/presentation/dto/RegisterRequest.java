package com.hercare.backend.modules.auth.presentation.dto;

import com.hercare.backend.modules.auth.domain.UserRole;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "name is required") @Size(max = 100) String name,
        @NotBlank(message = "email is required") @Email @Size(max = 320) String email,
        @NotBlank(message = "password is required") @Size(min = 8, max = 128) String password,
        @NotNull(message = "role is required") UserRole role,
        @Min(0) @Max(130) Integer age,
        @Size(max = 32) String phone
) {
}

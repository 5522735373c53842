package com.hercare.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

public record UpdateProfileRequest(
        @Size(min = 1, max = 100) String name,
        @Min(0) @Max(130) Integer age,
        @Size(max = 32) String phone
) {
}

package com.hercare.backend.modules.migration.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ClaimRequest(
        @NotBlank @Size(max = 32) String shareCode
) {
}

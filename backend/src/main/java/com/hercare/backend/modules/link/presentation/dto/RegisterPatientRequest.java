package com.hercare.backend.modules.link.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 의사가 환자를 등록. Without an email the patient is created as a shadow identity.
 */
public record RegisterPatientRequest(
        @NotBlank(message = "name is required") @Size(max = 100) String name,
        @Email @Size(max = 320) String email,
        @Min(0) @Max(130) Integer age
) {
}

package com.hercare.backend.modules.doctor.presentation.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

public record CreateDoctorProfileRequest(
        @Size(max = 120) String specialization,
        @Size(max = 200) String hospital,
        @Min(0) @Max(80) Integer experienceYears
) {
}

package com.hercare.backend.modules.healthlog.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * Create/update payload. On update, null fields keep their current value.
 */
public record HealthLogRequest(
        @Size(max = 50) String logType,
        @Size(max = 200) String title,
        String description,
        LocalDate logDate,
        @Min(0) @Max(10) Integer painLevel,
        @Size(max = 30) String bleedingLevel,
        @Size(max = 30) String mood,
        String notes
) {
}

package com.hercare.backend.modules.medication.presentation.dto;

import java.time.LocalDate;
import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateMedicationRequest(
        @NotBlank(message = "name is required") @Size(max = 200) String name,
        @Size(max = 100) String dosage,
        @Size(max = 100) String frequency,
        List<@Size(max = 20) String> times,
        LocalDate startDate,
        LocalDate endDate,
        String notes
) {
}

package com.hercare.backend.modules.medication.presentation.dto;

import java.time.LocalDate;
import java.util.List;

import jakarta.validation.constraints.Size;

public record UpdateMedicationRequest(
        @Size(min = 1, max = 200) String name,
        @Size(max = 100) String dosage,
        @Size(max = 100) String frequency,
        List<@Size(max = 20) String> times,
        LocalDate endDate,
        String notes,
        Boolean active
) {
}

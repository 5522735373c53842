package com.hercare.backend.modules.medication.presentation.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.hercare.backend.modules.medication.domain.Medication;

public record MedicationResponse(
        UUID id,
        UUID patientId,
        UUID prescribedBy,
        String name,
        String dosage,
        String frequency,
        List<String> times,
        LocalDate startDate,
        LocalDate endDate,
        String notes,
        boolean active
) {
    public static MedicationResponse from(Medication medication) {
        return new MedicationResponse(
                medication.getId(),
                medication.getPatientId(),
                medication.getPrescribedBy(),
                medication.getName(),
                medication.getDosage(),
                medication.getFrequency(),
                List.copyOf(medication.getTimes() != null ? medication.getTimes() : List.of()),
                medication.getStartDate(),
                medication.getEndDate(),
                medication.getNotes(),
                medication.isActive()
        );
    }
}

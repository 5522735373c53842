package com.hercare.backend.modules.history.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.hercare.backend.modules.history.domain.MedicalHistory;

public record MedicalHistoryResponse(
        UUID id,
        UUID patientId,
        String allergies,
        String chronicConditions,
        String surgeries,
        String medications,
        String consultingSummary,
        OffsetDateTime updatedAt
) {
    public static MedicalHistoryResponse from(MedicalHistory history) {
        return new MedicalHistoryResponse(
                history.getId(),
                history.getPatientId(),
                history.getAllergies(),
                history.getChronicConditions(),
                history.getSurgeries(),
                history.getMedications(),
                history.getConsultingSummary(),
                history.getUpdatedAt()
        );
    }
}

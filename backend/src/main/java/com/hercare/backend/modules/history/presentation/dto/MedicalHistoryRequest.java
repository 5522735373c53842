package com.hercare.backend.modules.history.presentation.dto;

/**
 * Upsert payload; null fields keep their stored value.
 */
public record MedicalHistoryRequest(
        String allergies,
        String chronicConditions,
        String surgeries,
        String medications,
        String consultingSummary
) {
}

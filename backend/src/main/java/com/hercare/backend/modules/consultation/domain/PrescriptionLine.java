package com.hercare.backend.modules.consultation.domain;

public record PrescriptionLine(
        String name,
        String dosage,
        String timing,
        String duration
) {
}

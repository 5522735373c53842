package com.hercare.backend.modules.healthlog.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.hercare.backend.modules.healthlog.domain.HealthLog;

public record HealthLogResponse(
        UUID id,
        UUID patientId,
        String logType,
        String title,
        String description,
        LocalDate logDate,
        Integer painLevel,
        String bleedingLevel,
        String mood,
        String notes,
        OffsetDateTime createdAt
) {
    public static HealthLogResponse from(HealthLog log) {
        return new HealthLogResponse(
                log.getId(),
                log.getPatientId(),
                log.getLogType(),
                log.getTitle(),
                log.getDescription(),
                log.getLogDate(),
                log.getPainLevel(),
                log.getBleedingLevel(),
                log.getMood(),
                log.getNotes(),
                log.getCreatedAt()
        );
    }
}

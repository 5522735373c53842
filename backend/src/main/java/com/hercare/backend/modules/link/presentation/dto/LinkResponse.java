package com.hercare.backend.modules.link.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.hercare.backend.modules.link.domain.DoctorPatientLink;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LinkResponse(
        UUID linkId,
        UUID doctorId,
        UUID patientId,
        String shareCode,
        Map<String, Boolean> permissions,
        OffsetDateTime createdAt
) {
    public static LinkResponse from(DoctorPatientLink link) {
        return new LinkResponse(
                link.getId(),
                link.getDoctorId(),
                link.getPatientId(),
                link.getShareCode(),
                link.getPermissions().effectiveByCode(),
                link.getCreatedAt()
        );
    }
}

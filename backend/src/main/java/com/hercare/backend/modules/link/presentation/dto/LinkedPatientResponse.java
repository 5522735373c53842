package com.hercare.backend.modules.link.presentation.dto;

import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LinkedPatientResponse(
        UUID linkId,
        UUID patientId,
        String name,
        Integer age,
        boolean shadow,
        String shareCode,
        Map<String, Boolean> permissions
) {
}

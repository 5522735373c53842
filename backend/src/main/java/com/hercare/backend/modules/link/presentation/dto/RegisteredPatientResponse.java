package com.hercare.backend.modules.link.presentation.dto;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RegisteredPatientResponse(
        Outcome outcome,
        UUID patientId,
        UUID linkId,
        String shareCode,
        String temporaryPassword
) {
    public enum Outcome {
        SHADOW_CREATED,
        ACCOUNT_CREATED,
        EXISTING_LINKED
    }
}

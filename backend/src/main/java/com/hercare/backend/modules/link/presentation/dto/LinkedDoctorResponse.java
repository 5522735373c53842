package com.hercare.backend.modules.link.presentation.dto;

import java.util.Map;
import java.util.UUID;

public record LinkedDoctorResponse(
        UUID linkId,
        UUID doctorId,
        String doctorName,
        String specialization,
        String hospital,
        Map<String, Boolean> permissions
) {
}

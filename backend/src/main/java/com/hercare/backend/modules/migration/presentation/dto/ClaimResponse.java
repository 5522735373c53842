package com.hercare.backend.modules.migration.presentation.dto;

import java.util.Map;
import java.util.UUID;

import com.hercare.backend.modules.migration.domain.ClaimOutcome;

/**
 * {@code movedCounts} is keyed by resource category code and is empty for {@link ClaimOutcome#ALREADY_LINKED}.
 */
public record ClaimResponse(
        ClaimOutcome outcome,
        UUID linkId,
        UUID doctorId,
        Map<String, Integer> movedCounts
) {
}

package com.hercare.backend.modules.migration.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.hercare.backend.modules.link.domain.ResourceCategory;

/**
 * Moves every record of one category from a shadow patient to the claiming patient.
 * Runs inside the claim transaction; implementations must not open their own.
 */
public interface OwnedRecordReassigner {

    ResourceCategory category();

    /**
     * @return number of rows now owned by {@code realPatientId} that used to belong to the shadow
     */
    int reassign(UUID shadowPatientId, UUID realPatientId, OffsetDateTime now);
}

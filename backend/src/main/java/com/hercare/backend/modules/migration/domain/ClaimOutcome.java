package com.hercare.backend.modules.migration.domain;

public enum ClaimOutcome {
    /** Records, link and identity were moved to the claiming patient. */
    MIGRATED,
    /** The share code already points at the claiming patient; nothing changed. */
    ALREADY_LINKED
}

package com.hercare.backend.modules.link.domain;

public enum AccessDecision {
    OWNER(true),
    PERMITTED(true),
    NOT_LINKED(false),
    REVOKED(false);

    private final boolean allowed;

    AccessDecision(boolean allowed) {
        this.allowed = allowed;
    }

    public boolean isAllowed() {
        return allowed;
    }
}

package com.hercare.backend.modules.link.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Clinical record categories a patient can grant or revoke per linked doctor.
 */
public enum ResourceCategory {
    HEALTH_LOGS("health_logs", true),
    MEDICATIONS("medications", true),
    REPORTS("reports", true),
    DIET_PLANS("diet_plans", true),
    MEDICAL_HISTORY("medical_history", true),
    CONSULTATIONS("consultations", true);

    private final String code;
    private final boolean defaultAllowed;

    ResourceCategory(String code, boolean defaultAllowed) {
        this.code = code;
        this.defaultAllowed = defaultAllowed;
    }

    public String getCode() {
        return code;
    }

    /**
     * Applied when the patient has not set a value for this category on the link.
     */
    public boolean isDefaultAllowed() {
        return defaultAllowed;
    }

    public static Optional<ResourceCategory> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(category -> category.code.equals(code))
                .findFirst();
    }
}

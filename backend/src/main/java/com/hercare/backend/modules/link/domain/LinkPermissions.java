package com.hercare.backend.modules.link.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Per-link permission flags, one nullable column per {@link ResourceCategory}.
 *
 * <p>{@code null} means the patient never set the flag and the category default applies.
 * Instances are immutable; {@link #with(ResourceCategory, Boolean)} returns a copy.</p>
 */
@Embeddable
public class LinkPermissions {

    @Column(name = "perm_health_logs")
    private Boolean healthLogs;

    @Column(name = "perm_medications")
    private Boolean medications;

    @Column(name = "perm_reports")
    private Boolean reports;

    @Column(name = "perm_diet_plans")
    private Boolean dietPlans;

    @Column(name = "perm_medical_history")
    private Boolean medicalHistory;

    @Column(name = "perm_consultations")
    private Boolean consultations;

    protected LinkPermissions() {
    }

    public static LinkPermissions unset() {
        return new LinkPermissions();
    }

    public static LinkPermissions of(Map<ResourceCategory, Boolean> values) {
        LinkPermissions permissions = new LinkPermissions();
        values.forEach(permissions::assign);
        return permissions;
    }

    /**
     * @return the stored flag, or {@code null} when unset
     */
    public Boolean explicitValue(ResourceCategory category) {
        return switch (category) {
            case HEALTH_LOGS -> healthLogs;
            case MEDICATIONS -> medications;
            case REPORTS -> reports;
            case DIET_PLANS -> dietPlans;
            case MEDICAL_HISTORY -> medicalHistory;
            case CONSULTATIONS -> consultations;
        };
    }

    public boolean isAllowed(ResourceCategory category) {
        Boolean value = explicitValue(category);
        return value != null ? value : category.isDefaultAllowed();
    }

    public LinkPermissions with(ResourceCategory category, Boolean value) {
        LinkPermissions copy = of(explicitValues());
        copy.assign(category, value);
        return copy;
    }

    public Map<ResourceCategory, Boolean> explicitValues() {
        Map<ResourceCategory, Boolean> values = new EnumMap<>(ResourceCategory.class);
        for (ResourceCategory category : ResourceCategory.values()) {
            Boolean value = explicitValue(category);
            if (value != null) {
                values.put(category, value);
            }
        }
        return values;
    }

    /**
     * Effective flags keyed by category code, in declaration order.
     */
    public Map<String, Boolean> effectiveByCode() {
        Map<String, Boolean> values = new LinkedHashMap<>();
        for (ResourceCategory category : ResourceCategory.values()) {
            values.put(category.getCode(), isAllowed(category));
        }
        return Collections.unmodifiableMap(values);
    }

    private void assign(ResourceCategory category, Boolean value) {
        switch (category) {
            case HEALTH_LOGS -> healthLogs = value;
            case MEDICATIONS -> medications = value;
            case REPORTS -> reports = value;
            case DIET_PLANS -> dietPlans = value;
            case MEDICAL_HISTORY -> medicalHistory = value;
            case CONSULTATIONS -> consultations = value;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LinkPermissions that)) {
            return false;
        }
        return explicitValues().equals(that.explicitValues());
    }

    @Override
    public int hashCode() {
        return Objects.hash(healthLogs, medications, reports, dietPlans, medicalHistory, consultations);
    }
}

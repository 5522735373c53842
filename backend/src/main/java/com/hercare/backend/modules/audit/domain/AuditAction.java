package com.hercare.backend.modules.audit.domain;

/**
 * 감사 로그 action_type 값.
 */
public enum AuditAction {
    REGISTER,
    LOGIN,
    LINK_CREATED,
    PERMISSIONS_UPDATED,
    RECORD_ACCESS_DENIED,
    SHADOW_CLAIMED,
    PATIENT_REGISTERED,
    DOCTOR_PROFILE_CREATED
}

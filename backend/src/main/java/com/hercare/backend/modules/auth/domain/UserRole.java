package com.hercare.backend.modules.auth.domain;

public enum UserRole {
    PATIENT,
    DOCTOR,
    HOSPITAL_ADMIN,
    SUPER_ADMIN
}

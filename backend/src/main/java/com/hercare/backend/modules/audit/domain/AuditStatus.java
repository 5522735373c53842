package com.hercare.backend.modules.audit.domain;

public enum AuditStatus {
    SUCCESS,
    FAILED,
    DENIED
}

package com.hercare.backend.modules.consultation.domain;

public enum PaymentStatus {
    PENDING,
    PAID
}

package com.hercare.backend.modules.consultation.domain;

import java.math.BigDecimal;

public record BillingItem(
        String service,
        BigDecimal cost
) {
}

package com.hercare.backend.modules.consultation.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import com.hercare.backend.modules.consultation.domain.BillingItem;
import com.hercare.backend.modules.consultation.domain.PrescriptionLine;

import jakarta.validation.constraints.DecimalMin;

/**
 * {@code totalAmount} defaults to the sum of the billing item costs when omitted.
 */
public record CreateConsultationRequest(
        LocalDate visitDate,
        String symptoms,
        String diagnosis,
        String treatmentPlan,
        List<PrescriptionLine> prescriptions,
        List<BillingItem> billingItems,
        @DecimalMin(value = "0.00") BigDecimal totalAmount,
        String prescriptionText,
        String notes
) {
}

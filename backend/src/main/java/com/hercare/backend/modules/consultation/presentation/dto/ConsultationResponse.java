package com.hercare.backend.modules.consultation.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.hercare.backend.modules.consultation.domain.BillingItem;
import com.hercare.backend.modules.consultation.domain.Consultation;
import com.hercare.backend.modules.consultation.domain.PaymentStatus;
import com.hercare.backend.modules.consultation.domain.PrescriptionLine;

public record ConsultationResponse(
        UUID id,
        UUID patientId,
        UUID doctorId,
        String doctorName,
        LocalDate visitDate,
        String symptoms,
        String diagnosis,
        String treatmentPlan,
        List<PrescriptionLine> prescriptions,
        List<BillingItem> billingItems,
        BigDecimal totalAmount,
        PaymentStatus paymentStatus,
        String prescriptionText,
        String notes
) {
    public static ConsultationResponse from(Consultation consultation, String doctorName) {
        return new ConsultationResponse(
                consultation.getId(),
                consultation.getPatientId(),
                consultation.getDoctorId(),
                doctorName,
                consultation.getVisitDate(),
                consultation.getSymptoms(),
                consultation.getDiagnosis(),
                consultation.getTreatmentPlan(),
                List.copyOf(consultation.getPrescriptions() != null ? consultation.getPrescriptions() : List.of()),
                List.copyOf(consultation.getBillingItems() != null ? consultation.getBillingItems() : List.of()),
                consultation.getTotalAmount(),
                consultation.getPaymentStatus(),
                consultation.getPrescriptionText(),
                consultation.getNotes()
        );
    }
}

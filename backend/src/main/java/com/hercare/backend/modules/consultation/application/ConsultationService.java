package com.hercare.backend.modules.consultation.application;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

import com.hercare.backend.global.error.ProblemException;
import com.hercare.backend.modules.auth.domain.HercareUser;
import com.hercare.backend.modules.auth.infrastructure.persistence.HercareUserRepository;
import com.hercare.backend.modules.consultation.domain.BillingItem;
import com.hercare.backend.modules.consultation.domain.Consultation;
import com.hercare.backend.modules.consultation.infrastructure.persistence.ConsultationRepository;
import com.hercare.backend.modules.consultation.presentation.dto.ConsultationResponse;
import com.hercare.backend.modules.consultation.presentation.dto.CreateConsultationRequest;
import com.hercare.backend.modules.link.application.RecordAccessGuard;
import com.hercare.backend.modules.link.domain.ResourceCategory;
import com.hercare.backend.modules.migration.application.OwnedRecordReassigner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ConsultationService implements OwnedRecordReassigner {

    private static final Logger log = LoggerFactory.getLogger(ConsultationService.class);

    private final ConsultationRepository consultationRepository;
    private final HercareUserRepository userRepository;
    private final RecordAccessGuard accessGuard;
    private final Clock clock;

    public ConsultationService(
            ConsultationRepository consultationRepository,
            HercareUserRepository userRepository,
            RecordAccessGuard accessGuard,
            Clock clock
    ) {
        this.consultationRepository = consultationRepository;
        this.userRepository = userRepository;
        this.accessGuard = accessGuard;
        this.clock = clock;
    }

    /**
     * Records a visit. The requesting doctor is stored as the consultation's doctor.
     */
    public ConsultationResponse create(UUID doctorId, UUID patientId, CreateConsultationRequest request) {
        accessGuard.checkWrite(doctorId, patientId, ResourceCategory.CONSULTATIONS);

        Consultation consultation = new Consultation();
        consultation.setDoctorId(doctorId);
        consultation.setPatientId(patientId);
        consultation.setVisitDate(request.visitDate() != null ? request.visitDate() : LocalDate.now(clock));
        consultation.setSymptoms(request.symptoms());
        consultation.setDiagnosis(request.diagnosis());
        consultation.setTreatmentPlan(request.treatmentPlan());
        consultation.setPrescriptions(request.prescriptions());
        consultation.setBillingItems(request.billingItems());
        consultation.setPrescriptionText(request.prescriptionText());
        consultation.setNotes(request.notes());
        consultation.bill(request.totalAmount() != null ? request.totalAmount() : sumCosts(request.billingItems()));

        Consultation saved = consultationRepository.saveAndFlush(consultation);
        log.info("Doctor {} recorded consultation {} for patient {}", doctorId, saved.getId(), patientId);
        return ConsultationResponse.from(saved, nameOf(doctorId));
    }

    @Transactional(readOnly = true)
    public List<ConsultationResponse> list(UUID requesterId, UUID patientId) {
        accessGuard.checkRead(requesterId, patientId, ResourceCategory.CONSULTATIONS);
        List<Consultation> consultations = consultationRepository.findByPatientId(patientId);
        List<UUID> doctorIds = consultations.stream().map(Consultation::getDoctorId).distinct().toList();
        Map<UUID, String> doctorNames = doctorIds.isEmpty()
                ? Map.of()
                : userRepository.findByIds(doctorIds).stream()
                        .collect(Collectors.toMap(HercareUser::getId, HercareUser::getName));
        return consultations.stream()
                .map(consultation -> ConsultationResponse.from(consultation, doctorNames.get(consultation.getDoctorId())))
                .toList();
    }

    public ConsultationResponse markPaid(UUID requesterId, UUID consultationId) {
        Consultation consultation = consultationRepository.findById(consultationId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "CONSULTATION_NOT_FOUND"));
        accessGuard.checkWrite(requesterId, consultation.getPatientId(), ResourceCategory.CONSULTATIONS);
        consultation.markPaid();
        Consultation saved = consultationRepository.saveAndFlush(consultation);
        return ConsultationResponse.from(saved, nameOf(saved.getDoctorId()));
    }

    @Override
    public ResourceCategory category() {
        return ResourceCategory.CONSULTATIONS;
    }

    @Override
    public int reassign(UUID shadowPatientId, UUID realPatientId, OffsetDateTime now) {
        return consultationRepository.reassignPatient(shadowPatientId, realPatientId, now);
    }

    private String nameOf(UUID userId) {
        return userRepository.findById(userId).map(HercareUser::getName).orElse(null);
    }

    private static BigDecimal sumCosts(List<BillingItem> items) {
        if (items == null) {
            return BigDecimal.ZERO;
        }
        return items.stream()
                .map(BillingItem::cost)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}

package com.hercare.backend.modules.medication.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.hercare.backend.global.error.ProblemException;
import com.hercare.backend.modules.link.application.RecordAccessGuard;
import com.hercare.backend.modules.link.domain.ResourceCategory;
import com.hercare.backend.modules.medication.domain.Medication;
import com.hercare.backend.modules.medication.infrastructure.persistence.MedicationRepository;
import com.hercare.backend.modules.medication.presentation.dto.CreateMedicationRequest;
import com.hercare.backend.modules.medication.presentation.dto.MedicationResponse;
import com.hercare.backend.modules.medication.presentation.dto.UpdateMedicationRequest;
import com.hercare.backend.modules.migration.application.OwnedRecordReassigner;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 복약 관리. Deactivation hides a medication from the default list; delete removes the row.
 */
@Service
@Transactional
public class MedicationService implements OwnedRecordReassigner {

    private final MedicationRepository medicationRepository;
    private final RecordAccessGuard accessGuard;
    private final Clock clock;

    public MedicationService(MedicationRepository medicationRepository, RecordAccessGuard accessGuard, Clock clock) {
        this.medicationRepository = medicationRepository;
        this.accessGuard = accessGuard;
        this.clock = clock;
    }

    public MedicationResponse create(UUID requesterId, UUID patientId, CreateMedicationRequest request) {
        accessGuard.checkWrite(requesterId, patientId, ResourceCategory.MEDICATIONS);

        LocalDate startDate = request.startDate() != null ? request.startDate() : LocalDate.now(clock);
        validateDates(startDate, request.endDate());

        Medication medication = new Medication();
        medication.setPatientId(patientId);
        medication.setPrescribedBy(requesterId.equals(patientId) ? null : requesterId);
        medication.setName(request.name().trim());
        medication.setDosage(request.dosage());
        medication.setFrequency(request.frequency());
        medication.setTimes(request.times());
        medication.setStartDate(startDate);
        medication.setEndDate(request.endDate());
        medication.setNotes(request.notes());
        medication.setActive(true);
        return MedicationResponse.from(medicationRepository.saveAndFlush(medication));
    }

    @Transactional(readOnly = true)
    public List<MedicationResponse> list(UUID requesterId, UUID patientId, boolean includeInactive) {
        accessGuard.checkRead(requesterId, patientId, ResourceCategory.MEDICATIONS);
        return medicationRepository.findByPatientId(patientId, includeInactive).stream()
                .map(MedicationResponse::from)
                .toList();
    }

    public MedicationResponse update(UUID requesterId, UUID medicationId, UpdateMedicationRequest request) {
        Medication medication = load(medicationId);
        accessGuard.checkWrite(requesterId, medication.getPatientId(), ResourceCategory.MEDICATIONS);

        if (request.name() != null) {
            medication.setName(request.name().trim());
        }
        if (request.dosage() != null) {
            medication.setDosage(request.dosage());
        }
        if (request.frequency() != null) {
            medication.setFrequency(request.frequency());
        }
        if (request.times() != null) {
            medication.setTimes(request.times());
        }
        if (request.endDate() != null) {
            validateDates(medication.getStartDate(), request.endDate());
            medication.setEndDate(request.endDate());
        }
        if (request.notes() != null) {
            medication.setNotes(request.notes());
        }
        if (request.active() != null) {
            medication.setActive(request.active());
        }
        return MedicationResponse.from(medicationRepository.saveAndFlush(medication));
    }

    public MedicationResponse deactivate(UUID requesterId, UUID medicationId) {
        Medication medication = load(medicationId);
        accessGuard.checkWrite(requesterId, medication.getPatientId(), ResourceCategory.MEDICATIONS);
        medication.setActive(false);
        return MedicationResponse.from(medicationRepository.saveAndFlush(medication));
    }

    public void delete(UUID requesterId, UUID medicationId) {
        Medication medication = load(medicationId);
        accessGuard.checkWrite(requesterId, medication.getPatientId(), ResourceCategory.MEDICATIONS);
        medicationRepository.delete(medication);
    }

    @Override
    public ResourceCategory category() {
        return ResourceCategory.MEDICATIONS;
    }

    @Override
    public int reassign(UUID shadowPatientId, UUID realPatientId, OffsetDateTime now) {
        return medicationRepository.reassignPatient(shadowPatientId, realPatientId, now);
    }

    private Medication load(UUID medicationId) {
        return medicationRepository.findById(medicationId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "MEDICATION_NOT_FOUND"));
    }

    private static void validateDates(LocalDate startDate, LocalDate endDate) {
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_DATE_RANGE",
                    "endDate must not be before startDate");
        }
    }
}

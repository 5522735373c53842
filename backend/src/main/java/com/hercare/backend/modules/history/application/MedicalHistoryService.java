package com.hercare.backend.modules.history.application;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.hercare.backend.modules.history.domain.MedicalHistory;
import com.hercare.backend.modules.history.infrastructure.persistence.MedicalHistoryRepository;
import com.hercare.backend.modules.history.presentation.dto.MedicalHistoryRequest;
import com.hercare.backend.modules.history.presentation.dto.MedicalHistoryResponse;
import com.hercare.backend.modules.link.application.RecordAccessGuard;
import com.hercare.backend.modules.link.domain.ResourceCategory;
import com.hercare.backend.modules.migration.application.OwnedRecordReassigner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class MedicalHistoryService implements OwnedRecordReassigner {

    private static final Logger log = LoggerFactory.getLogger(MedicalHistoryService.class);

    private final MedicalHistoryRepository historyRepository;
    private final RecordAccessGuard accessGuard;

    public MedicalHistoryService(MedicalHistoryRepository historyRepository, RecordAccessGuard accessGuard) {
        this.historyRepository = historyRepository;
        this.accessGuard = accessGuard;
    }

    @Transactional(readOnly = true)
    public Optional<MedicalHistoryResponse> get(UUID requesterId, UUID patientId) {
        accessGuard.checkRead(requesterId, patientId, ResourceCategory.MEDICAL_HISTORY);
        return historyRepository.findByPatientId(patientId).map(MedicalHistoryResponse::from);
    }

    public MedicalHistoryResponse upsert(UUID requesterId, UUID patientId, MedicalHistoryRequest request) {
        accessGuard.checkWrite(requesterId, patientId, ResourceCategory.MEDICAL_HISTORY);

        MedicalHistory history = historyRepository.findByPatientId(patientId).orElseGet(() -> {
            MedicalHistory created = new MedicalHistory();
            created.setPatientId(patientId);
            return created;
        });
        if (request.allergies() != null) {
            history.setAllergies(request.allergies());
        }
        if (request.chronicConditions() != null) {
            history.setChronicConditions(request.chronicConditions());
        }
        if (request.surgeries() != null) {
            history.setSurgeries(request.surgeries());
        }
        if (request.medications() != null) {
            history.setMedications(request.medications());
        }
        if (request.consultingSummary() != null) {
            history.setConsultingSummary(request.consultingSummary());
        }
        return MedicalHistoryResponse.from(historyRepository.saveAndFlush(history));
    }

    @Override
    public ResourceCategory category() {
        return ResourceCategory.MEDICAL_HISTORY;
    }

    /**
     * One history per patient: when the claimer already has one, the shadow record only fills its
     * blank fields and is then removed.
     */
    @Override
    public int reassign(UUID shadowPatientId, UUID realPatientId, OffsetDateTime now) {
        Optional<MedicalHistory> shadowHistory = historyRepository.findByPatientId(shadowPatientId);
        if (shadowHistory.isEmpty()) {
            return 0;
        }
        Optional<MedicalHistory> realHistory = historyRepository.findByPatientId(realPatientId);
        if (realHistory.isEmpty()) {
            return historyRepository.reassignPatient(shadowPatientId, realPatientId, now);
        }

        MedicalHistory merged = realHistory.get();
        merged.fillBlanksFrom(shadowHistory.get());
        historyRepository.delete(shadowHistory.get());
        historyRepository.saveAndFlush(merged);
        log.info("Merged shadow medical history into patient {}", realPatientId);
        return 1;
    }
}

package com.hercare.backend.modules.healthlog.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.hercare.backend.global.error.ProblemException;
import com.hercare.backend.modules.healthlog.domain.HealthLog;
import com.hercare.backend.modules.healthlog.infrastructure.persistence.HealthLogRepository;
import com.hercare.backend.modules.healthlog.presentation.dto.HealthLogRequest;
import com.hercare.backend.modules.healthlog.presentation.dto.HealthLogResponse;
import com.hercare.backend.modules.link.application.RecordAccessGuard;
import com.hercare.backend.modules.link.domain.ResourceCategory;
import com.hercare.backend.modules.migration.application.OwnedRecordReassigner;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class HealthLogService implements OwnedRecordReassigner {

    private static final String DEFAULT_LOG_TYPE = "health_check";

    private final HealthLogRepository healthLogRepository;
    private final RecordAccessGuard accessGuard;
    private final Clock clock;

    public HealthLogService(HealthLogRepository healthLogRepository, RecordAccessGuard accessGuard, Clock clock) {
        this.healthLogRepository = healthLogRepository;
        this.accessGuard = accessGuard;
        this.clock = clock;
    }

    public HealthLogResponse create(UUID requesterId, UUID patientId, HealthLogRequest request) {
        accessGuard.checkWrite(requesterId, patientId, ResourceCategory.HEALTH_LOGS);

        HealthLog log = new HealthLog();
        log.setPatientId(patientId);
        String logType = request.logType() != null && !request.logType().isBlank() ? request.logType() : DEFAULT_LOG_TYPE;
        log.setLogType(logType);
        log.setTitle(request.title() != null && !request.title().isBlank() ? request.title() : logType);
        log.setDescription(request.description());
        log.setLogDate(request.logDate() != null ? request.logDate() : LocalDate.now(clock));
        log.setPainLevel(request.painLevel());
        log.setBleedingLevel(request.bleedingLevel());
        log.setMood(request.mood());
        log.setNotes(request.notes());
        return HealthLogResponse.from(healthLogRepository.saveAndFlush(log));
    }

    @Transactional(readOnly = true)
    public List<HealthLogResponse> list(UUID requesterId, UUID patientId) {
        accessGuard.checkRead(requesterId, patientId, ResourceCategory.HEALTH_LOGS);
        return healthLogRepository.findByPatientId(patientId).stream()
                .map(HealthLogResponse::from)
                .toList();
    }

    public HealthLogResponse update(UUID requesterId, UUID logId, HealthLogRequest request) {
        HealthLog log = load(logId);
        accessGuard.checkWrite(requesterId, log.getPatientId(), ResourceCategory.HEALTH_LOGS);

        if (request.logType() != null) {
            log.setLogType(request.logType());
        }
        if (request.title() != null) {
            log.setTitle(request.title());
        }
        if (request.description() != null) {
            log.setDescription(request.description());
        }
        if (request.logDate() != null) {
            log.setLogDate(request.logDate());
        }
        if (request.painLevel() != null) {
            log.setPainLevel(request.painLevel());
        }
        if (request.bleedingLevel() != null) {
            log.setBleedingLevel(request.bleedingLevel());
        }
        if (request.mood() != null) {
            log.setMood(request.mood());
        }
        if (request.notes() != null) {
            log.setNotes(request.notes());
        }
        return HealthLogResponse.from(healthLogRepository.saveAndFlush(log));
    }

    public void delete(UUID requesterId, UUID logId) {
        HealthLog log = load(logId);
        accessGuard.checkWrite(requesterId, log.getPatientId(), ResourceCategory.HEALTH_LOGS);
        healthLogRepository.delete(log);
    }

    @Override
    public ResourceCategory category() {
        return ResourceCategory.HEALTH_LOGS;
    }

    @Override
    public int reassign(UUID shadowPatientId, UUID realPatientId, OffsetDateTime now) {
        return healthLogRepository.reassignPatient(shadowPatientId, realPatientId, now);
    }

    private HealthLog load(UUID logId) {
        return healthLogRepository.findById(logId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "HEALTH_LOG_NOT_FOUND"));
    }
}

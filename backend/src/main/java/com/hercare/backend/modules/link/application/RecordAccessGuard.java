package com.hercare.backend.modules.link.application;

import java.util.Map;
import java.util.UUID;

import com.hercare.backend.global.error.ProblemException;
import com.hercare.backend.modules.audit.application.AuditLogService;
import com.hercare.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.hercare.backend.modules.audit.domain.AuditAction;
import com.hercare.backend.modules.audit.domain.AuditStatus;
import com.hercare.backend.modules.auth.infrastructure.persistence.HercareUserRepository;
import com.hercare.backend.modules.link.domain.AccessDecision;
import com.hercare.backend.modules.link.domain.DoctorPatientLink;
import com.hercare.backend.modules.link.domain.ResourceCategory;
import com.hercare.backend.modules.link.infrastructure.persistence.DoctorPatientLinkRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Gate shared by every clinical record service. Reads and writes both pass through it.
 */
@Component
public class RecordAccessGuard {

    private static final Logger log = LoggerFactory.getLogger(RecordAccessGuard.class);

    private final HercareUserRepository userRepository;
    private final DoctorPatientLinkRepository linkRepository;
    private final PermissionEvaluator permissionEvaluator;
    private final AuditLogService auditLogService;

    public RecordAccessGuard(
            HercareUserRepository userRepository,
            DoctorPatientLinkRepository linkRepository,
            PermissionEvaluator permissionEvaluator,
            AuditLogService auditLogService
    ) {
        this.userRepository = userRepository;
        this.linkRepository = linkRepository;
        this.permissionEvaluator = permissionEvaluator;
        this.auditLogService = auditLogService;
    }

    /**
     * @throws ProblemException 404 {@code PATIENT_NOT_FOUND}, 403 {@code NOT_LINKED} or 403 {@code NOT_AUTHORIZED}
     */
    public AccessDecision check(UUID requesterId, UUID patientId, ResourceCategory category, AccessMode mode) {
        if (!userRepository.existsById(patientId)) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "PATIENT_NOT_FOUND");
        }

        DoctorPatientLink link = requesterId.equals(patientId)
                ? null
                : linkRepository.findByDoctorIdAndPatientId(requesterId, patientId).orElse(null);
        AccessDecision decision = permissionEvaluator.evaluate(requesterId, patientId, category, link);
        log.debug("Access {} for {} on {}:{} ({})", decision, requesterId, category.getCode(), patientId, mode);

        if (decision.isAllowed()) {
            return decision;
        }

        log.warn("Denied {} access to {} of patient {} for requester {}: {}",
                mode, category.getCode(), patientId, requesterId, decision);
        auditLogService.record(new AuditLogCommand(
                AuditAction.RECORD_ACCESS_DENIED,
                category.getCode(),
                patientId.toString(),
                requesterId,
                AuditStatus.DENIED,
                Map.of("decision", decision.name(), "mode", mode.name())
        ));

        if (decision == AccessDecision.NOT_LINKED) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "NOT_LINKED");
        }
        throw new ProblemException(HttpStatus.FORBIDDEN, "NOT_AUTHORIZED");
    }

    public AccessDecision checkRead(UUID requesterId, UUID patientId, ResourceCategory category) {
        return check(requesterId, patientId, category, AccessMode.READ);
    }

    public AccessDecision checkWrite(UUID requesterId, UUID patientId, ResourceCategory category) {
        return check(requesterId, patientId, category, AccessMode.WRITE);
    }

    public enum AccessMode {
        READ,
        WRITE
    }
}

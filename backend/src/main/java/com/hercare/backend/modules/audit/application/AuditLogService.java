package com.hercare.backend.modules.audit.application;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.hercare.backend.global.web.RequestIdFilter;
import com.hercare.backend.modules.audit.domain.AuditAction;
import com.hercare.backend.modules.audit.domain.AuditLog;
import com.hercare.backend.modules.audit.domain.AuditStatus;
import com.hercare.backend.modules.audit.infrastructure.AuditLogRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Append-only audit sink.
 *
 * <p>Each entry is written in its own transaction so that a denial is kept even when the caller's
 * transaction rolls back. A failure to write is logged and never reaches the caller.</p>
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private final AuditLogRepository auditLogRepository;
    private final TransactionTemplate requiresNewTemplate;

    public AuditLogService(AuditLogRepository auditLogRepository, PlatformTransactionManager transactionManager) {
        this.auditLogRepository = auditLogRepository;
        this.requiresNewTemplate = new TransactionTemplate(transactionManager);
        this.requiresNewTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.action(), "action is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.action().name());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setActorUserId(command.actorUserId());
        auditLog.setStatus(command.status() != null ? command.status() : AuditStatus.SUCCESS);
        auditLog.setRequestId(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        try {
            requiresNewTemplate.executeWithoutResult(status -> auditLogRepository.saveAndFlush(auditLog));
        } catch (RuntimeException ex) {
            log.warn("Failed to write audit entry {} {}:{} for actor {}",
                    command.action(), command.resourceType(), command.resourceKey(), command.actorUserId(), ex);
        }
    }

    public record AuditLogCommand(
            AuditAction action,
            String resourceType,
            String resourceKey,
            UUID actorUserId,
            AuditStatus status,
            Map<String, Object> detail
    ) {
        public static AuditLogCommand success(AuditAction action, String resourceType, Object resourceKey,
                                              UUID actorUserId, Map<String, Object> detail) {
            return new AuditLogCommand(action, resourceType, String.valueOf(resourceKey), actorUserId, AuditStatus.SUCCESS, detail);
        }
    }
}

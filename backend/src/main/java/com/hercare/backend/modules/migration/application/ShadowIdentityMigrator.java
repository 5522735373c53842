package com.hercare.backend.modules.migration.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.hercare.backend.global.error.ProblemException;
import com.hercare.backend.modules.audit.application.AuditLogService;
import com.hercare.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.hercare.backend.modules.audit.domain.AuditAction;
import com.hercare.backend.modules.auth.application.IdentityService;
import com.hercare.backend.modules.auth.domain.HercareUser;
import com.hercare.backend.modules.auth.domain.UserRole;
import com.hercare.backend.modules.link.application.LinkRegistryService;
import com.hercare.backend.modules.link.domain.DoctorPatientLink;
import com.hercare.backend.modules.link.infrastructure.persistence.DoctorPatientLinkRepository;
import com.hercare.backend.modules.migration.domain.ClaimOutcome;
import com.hercare.backend.modules.migration.presentation.dto.ClaimResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 의사가 만든 shadow 환자를 실제 가입한 환자 계정으로 이관한다.
 *
 * <p>공유 코드로 연결 행을 잠근 뒤 모든 카테고리의 기록, 연결, shadow 사용자 삭제까지 하나의 트랜잭션에서
 * 처리한다. 중간에 실패하면 전체가 롤백된다.</p>
 */
@Service
public class ShadowIdentityMigrator {

    private static final Logger log = LoggerFactory.getLogger(ShadowIdentityMigrator.class);
    private static final String RESOURCE_LINK = "DOCTOR_PATIENT_LINK";

    private final LinkRegistryService linkRegistryService;
    private final DoctorPatientLinkRepository linkRepository;
    private final IdentityService identityService;
    private final List<OwnedRecordReassigner> reassigners;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public ShadowIdentityMigrator(
            LinkRegistryService linkRegistryService,
            DoctorPatientLinkRepository linkRepository,
            IdentityService identityService,
            List<OwnedRecordReassigner> reassigners,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.linkRegistryService = linkRegistryService;
        this.linkRepository = linkRepository;
        this.identityService = identityService;
        this.reassigners = reassigners.stream()
                .sorted(Comparator.comparing(OwnedRecordReassigner::category))
                .toList();
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional
    public ClaimResponse claim(String shareCode, UUID realUserId) {
        String code = normalizeCode(shareCode);
        DoctorPatientLink link = (code == null ? Optional.<DoctorPatientLink>empty() : linkRegistryService.findByShareCodeForUpdate(code))
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "INVALID_CODE"));

        if (link.getPatientId().equals(realUserId)) {
            return new ClaimResponse(ClaimOutcome.ALREADY_LINKED, link.getId(), link.getDoctorId(), Collections.emptyMap());
        }

        HercareUser claimer = identityService.getUser(realUserId);
        if (!claimer.hasRole(UserRole.PATIENT)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "NOT_AUTHORIZED");
        }
        UUID shadowId = link.getPatientId();
        UUID doctorId = link.getDoctorId();
        UUID linkId = link.getId();
        if (!identityService.getUser(shadowId).isShadow()) {
            throw new ProblemException(HttpStatus.CONFLICT, "ALREADY_MIGRATED");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Map<String, Integer> movedCounts = new LinkedHashMap<>();
        for (OwnedRecordReassigner reassigner : reassigners) {
            int moved = reassigner.reassign(shadowId, realUserId, now);
            movedCounts.put(reassigner.category().getCode(), moved);
            log.debug("Reassigned {} {} row(s) from {} to {}", moved, reassigner.category().getCode(), shadowId, realUserId);
        }

        // bulk updates clear the persistence context, so the link and the shadow user are loaded again
        DoctorPatientLink shadowLink = linkRepository.findById(linkId)
                .orElseThrow(() -> new IllegalStateException("Link " + linkId + " vanished during claim"));
        Optional<DoctorPatientLink> existing = linkRegistryService.findLink(doctorId, realUserId);
        UUID resultingLinkId;
        if (existing.isPresent()) {
            linkRepository.delete(shadowLink);
            linkRepository.flush();
            resultingLinkId = existing.get().getId();
        } else {
            shadowLink.reassignPatient(realUserId);
            linkRepository.saveAndFlush(shadowLink);
            resultingLinkId = linkId;
        }

        identityService.deleteShadow(identityService.getUser(shadowId));

        Map<String, Object> detail = new HashMap<>();
        detail.put("shadowPatientId", shadowId.toString());
        detail.put("doctorId", doctorId.toString());
        detail.put("mergedIntoExistingLink", existing.isPresent());
        detail.put("movedCounts", movedCounts);
        auditLogService.record(AuditLogCommand.success(
                AuditAction.SHADOW_CLAIMED, RESOURCE_LINK, resultingLinkId, realUserId, detail));
        log.info("Patient {} claimed shadow {} of doctor {} (moved {})", realUserId, shadowId, doctorId, movedCounts);

        return new ClaimResponse(ClaimOutcome.MIGRATED, resultingLinkId, doctorId, Collections.unmodifiableMap(movedCounts));
    }

    static String normalizeCode(String shareCode) {
        if (shareCode == null || shareCode.isBlank()) {
            return null;
        }
        return shareCode.trim().toUpperCase(Locale.ROOT);
    }
}

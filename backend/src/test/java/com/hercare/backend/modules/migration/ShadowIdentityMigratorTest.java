package com.hercare.backend.modules.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
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
import com.hercare.backend.modules.link.domain.ResourceCategory;
import com.hercare.backend.modules.link.infrastructure.persistence.DoctorPatientLinkRepository;
import com.hercare.backend.modules.migration.application.OwnedRecordReassigner;
import com.hercare.backend.modules.migration.application.ShadowIdentityMigrator;
import com.hercare.backend.modules.migration.domain.ClaimOutcome;
import com.hercare.backend.modules.migration.presentation.dto.ClaimResponse;
import com.hercare.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class ShadowIdentityMigratorTest {

    private static final UUID DOCTOR = UUID.fromString("00000000-0000-0000-0000-0000000000d1");
    private static final UUID SHADOW = UUID.fromString("00000000-0000-0000-0000-0000000000b1");
    private static final UUID REAL = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
    private static final UUID LINK_ID = UUID.fromString("00000000-0000-0000-0000-0000000000c1");
    private static final String CODE = "AB12CD34";

    @Mock
    private LinkRegistryService linkRegistryService;

    @Mock
    private DoctorPatientLinkRepository linkRepository;

    @Mock
    private IdentityService identityService;

    @Mock
    private AuditLogService auditLogService;

    @Mock
    private OwnedRecordReassigner consultations;

    @Mock
    private OwnedRecordReassigner healthLogs;

    private Clock clock;
    private ShadowIdentityMigrator migrator;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2026-03-01T09:00:00Z").toInstant(), ZoneOffset.UTC);
        when(consultations.category()).thenReturn(ResourceCategory.CONSULTATIONS);
        when(healthLogs.category()).thenReturn(ResourceCategory.HEALTH_LOGS);
        migrator = new ShadowIdentityMigrator(linkRegistryService, linkRepository, identityService,
                List.of(consultations, healthLogs), auditLogService, clock);
    }

    private DoctorPatientLink givenShadowLink() {
        DoctorPatientLink link = TestEntities.link(LINK_ID, DOCTOR, SHADOW, CODE);
        when(linkRegistryService.findByShareCodeForUpdate(CODE)).thenReturn(Optional.of(link));
        return link;
    }

    @Test
    void unknownCodeIsInvalid() {
        when(linkRegistryService.findByShareCodeForUpdate(CODE)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> migrator.claim(" ab12cd34 ", REAL))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("INVALID_CODE");
                });
    }

    @Test
    void blankCodeIsInvalidWithoutQuery() {
        assertThatThrownBy(() -> migrator.claim("   ", REAL))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_CODE"));
        verify(linkRegistryService, never()).findByShareCodeForUpdate(any());
    }

    @Test
    void claimingOwnLinkIsNoOp() {
        DoctorPatientLink link = TestEntities.link(LINK_ID, DOCTOR, REAL, CODE);
        when(linkRegistryService.findByShareCodeForUpdate(CODE)).thenReturn(Optional.of(link));

        ClaimResponse response = migrator.claim(CODE, REAL);

        assertThat(response.outcome()).isEqualTo(ClaimOutcome.ALREADY_LINKED);
        assertThat(response.movedCounts()).isEmpty();
        verify(consultations, never()).reassign(any(), any(), any());
        verify(identityService, never()).deleteShadow(any());
    }

    @Test
    void doctorCannotClaim() {
        givenShadowLink();
        when(identityService.getUser(REAL)).thenReturn(TestEntities.user(REAL, UserRole.DOCTOR, "doc2@example.com"));

        assertThatThrownBy(() -> migrator.claim(CODE, REAL))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo("NOT_AUTHORIZED");
                });
    }

    @Test
    void registeredPatientBehindCodeIsAlreadyMigrated() {
        givenShadowLink();
        when(identityService.getUser(REAL)).thenReturn(TestEntities.user(REAL, UserRole.PATIENT, "real@example.com"));
        when(identityService.getUser(SHADOW)).thenReturn(TestEntities.user(SHADOW, UserRole.PATIENT, "other@example.com"));

        assertThatThrownBy(() -> migrator.claim(CODE, REAL))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("ALREADY_MIGRATED");
                });
        verify(healthLogs, never()).reassign(any(), any(), any());
    }

    @Test
    @DisplayName("shadow 기록과 연결을 실제 환자에게 옮기고 shadow 사용자를 삭제한다")
    void migratesRecordsLinkAndDeletesShadow() {
        givenShadowLink();
        HercareUser shadow = TestEntities.shadowPatient(SHADOW);
        when(identityService.getUser(REAL)).thenReturn(TestEntities.user(REAL, UserRole.PATIENT, "real@example.com"));
        when(identityService.getUser(SHADOW)).thenReturn(shadow);
        OffsetDateTime now = OffsetDateTime.now(clock);
        when(healthLogs.reassign(SHADOW, REAL, now)).thenReturn(3);
        when(consultations.reassign(SHADOW, REAL, now)).thenReturn(1);
        DoctorPatientLink reloaded = TestEntities.link(LINK_ID, DOCTOR, SHADOW, CODE);
        when(linkRepository.findById(LINK_ID)).thenReturn(Optional.of(reloaded));
        when(linkRegistryService.findLink(DOCTOR, REAL)).thenReturn(Optional.empty());

        ClaimResponse response = migrator.claim(CODE, REAL);

        assertThat(response.outcome()).isEqualTo(ClaimOutcome.MIGRATED);
        assertThat(response.linkId()).isEqualTo(LINK_ID);
        assertThat(response.doctorId()).isEqualTo(DOCTOR);
        assertThat(response.movedCounts()).containsExactly(
                entry("health_logs", 3),
                entry("consultations", 1));
        assertThat(reloaded.getPatientId()).isEqualTo(REAL);
        assertThat(reloaded.getShareCode()).isNull();
        verify(linkRepository).saveAndFlush(reloaded);
        verify(identityService).deleteShadow(shadow);

        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(captor.capture());
        assertThat(captor.getValue().action()).isEqualTo(AuditAction.SHADOW_CLAIMED);
        assertThat(captor.getValue().actorUserId()).isEqualTo(REAL);
    }

    @Test
    void existingLinkToSameDoctorWinsOverShadowLink() {
        givenShadowLink();
        when(identityService.getUser(REAL)).thenReturn(TestEntities.user(REAL, UserRole.PATIENT, "real@example.com"));
        when(identityService.getUser(SHADOW)).thenReturn(TestEntities.shadowPatient(SHADOW));
        DoctorPatientLink reloaded = TestEntities.link(LINK_ID, DOCTOR, SHADOW, CODE);
        UUID existingId = UUID.randomUUID();
        DoctorPatientLink existing = TestEntities.link(existingId, DOCTOR, REAL, null);
        when(linkRepository.findById(LINK_ID)).thenReturn(Optional.of(reloaded));
        when(linkRegistryService.findLink(DOCTOR, REAL)).thenReturn(Optional.of(existing));

        ClaimResponse response = migrator.claim(CODE, REAL);

        assertThat(response.linkId()).isEqualTo(existingId);
        verify(linkRepository).delete(reloaded);
        verify(linkRepository, never()).saveAndFlush(any());
    }

    @Test
    void failingReassignmentStopsBeforeIdentityIsDeleted() {
        givenShadowLink();
        when(identityService.getUser(REAL)).thenReturn(TestEntities.user(REAL, UserRole.PATIENT, "real@example.com"));
        when(identityService.getUser(SHADOW)).thenReturn(TestEntities.shadowPatient(SHADOW));
        when(healthLogs.reassign(any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> migrator.claim(CODE, REAL)).isInstanceOf(IllegalStateException.class);
        verify(identityService, never()).deleteShadow(any());
        verify(auditLogService, never()).record(any());
    }
}

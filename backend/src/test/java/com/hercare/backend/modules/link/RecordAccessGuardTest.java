package com.hercare.backend.modules.link;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.UUID;

import com.hercare.backend.global.error.ProblemException;
import com.hercare.backend.modules.audit.application.AuditLogService;
import com.hercare.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.hercare.backend.modules.audit.domain.AuditAction;
import com.hercare.backend.modules.audit.domain.AuditStatus;
import com.hercare.backend.modules.auth.infrastructure.persistence.HercareUserRepository;
import com.hercare.backend.modules.link.application.PermissionEvaluator;
import com.hercare.backend.modules.link.application.RecordAccessGuard;
import com.hercare.backend.modules.link.domain.AccessDecision;
import com.hercare.backend.modules.link.domain.DoctorPatientLink;
import com.hercare.backend.modules.link.domain.LinkPermissions;
import com.hercare.backend.modules.link.domain.ResourceCategory;
import com.hercare.backend.modules.link.infrastructure.persistence.DoctorPatientLinkRepository;
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
class RecordAccessGuardTest {

    private static final UUID DOCTOR = UUID.fromString("00000000-0000-0000-0000-0000000000d1");
    private static final UUID PATIENT = UUID.fromString("00000000-0000-0000-0000-0000000000a1");

    @Mock
    private HercareUserRepository userRepository;

    @Mock
    private DoctorPatientLinkRepository linkRepository;

    @Mock
    private AuditLogService auditLogService;

    private RecordAccessGuard guard;

    @BeforeEach
    void setUp() {
        guard = new RecordAccessGuard(userRepository, linkRepository, new PermissionEvaluator(), auditLogService);
    }

    @Test
    void unknownPatientIsNotFound() {
        when(userRepository.existsById(PATIENT)).thenReturn(false);

        assertThatThrownBy(() -> guard.checkRead(DOCTOR, PATIENT, ResourceCategory.HEALTH_LOGS))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("PATIENT_NOT_FOUND");
                });
        verifyNoInteractions(auditLogService);
    }

    @Test
    void ownerSkipsLinkLookup() {
        when(userRepository.existsById(PATIENT)).thenReturn(true);

        AccessDecision decision = guard.checkWrite(PATIENT, PATIENT, ResourceCategory.MEDICATIONS);

        assertThat(decision).isEqualTo(AccessDecision.OWNER);
        verify(linkRepository, never()).findByDoctorIdAndPatientId(any(), any());
    }

    @Test
    @DisplayName("연결되지 않은 의사는 NOT_LINKED 로 거부되고 감사 로그가 남는다")
    void unlinkedDoctorIsDeniedAndAudited() {
        when(userRepository.existsById(PATIENT)).thenReturn(true);
        when(linkRepository.findByDoctorIdAndPatientId(DOCTOR, PATIENT)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> guard.checkRead(DOCTOR, PATIENT, ResourceCategory.REPORTS))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo("NOT_LINKED");
                });

        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(captor.capture());
        AuditLogCommand command = captor.getValue();
        assertThat(command.action()).isEqualTo(AuditAction.RECORD_ACCESS_DENIED);
        assertThat(command.status()).isEqualTo(AuditStatus.DENIED);
        assertThat(command.resourceType()).isEqualTo("reports");
        assertThat(command.actorUserId()).isEqualTo(DOCTOR);
        assertThat(command.detail()).containsEntry("decision", "NOT_LINKED").containsEntry("mode", "READ");
    }

    @Test
    void revokedCategoryIsNotAuthorized() {
        DoctorPatientLink link = TestEntities.link(UUID.randomUUID(), DOCTOR, PATIENT, null);
        link.replacePermissions(LinkPermissions.unset().with(ResourceCategory.HEALTH_LOGS, false));
        when(userRepository.existsById(PATIENT)).thenReturn(true);
        when(linkRepository.findByDoctorIdAndPatientId(DOCTOR, PATIENT)).thenReturn(Optional.of(link));

        assertThatThrownBy(() -> guard.checkWrite(DOCTOR, PATIENT, ResourceCategory.HEALTH_LOGS))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("NOT_AUTHORIZED"));
        assertThat(guard.checkRead(DOCTOR, PATIENT, ResourceCategory.MEDICATIONS)).isEqualTo(AccessDecision.PERMITTED);
    }

    @Test
    void permissionChangeIsSeenOnNextCheck() {
        DoctorPatientLink link = TestEntities.link(UUID.randomUUID(), DOCTOR, PATIENT, null);
        when(userRepository.existsById(PATIENT)).thenReturn(true);
        when(linkRepository.findByDoctorIdAndPatientId(DOCTOR, PATIENT)).thenReturn(Optional.of(link));

        assertThat(guard.checkRead(DOCTOR, PATIENT, ResourceCategory.DIET_PLANS)).isEqualTo(AccessDecision.PERMITTED);

        link.replacePermissions(LinkPermissions.unset().with(ResourceCategory.DIET_PLANS, false));

        assertThatThrownBy(() -> guard.checkRead(DOCTOR, PATIENT, ResourceCategory.DIET_PLANS))
                .isInstanceOf(ProblemException.class);
    }
}

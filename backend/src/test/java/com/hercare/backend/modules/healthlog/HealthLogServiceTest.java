package com.hercare.backend.modules.healthlog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.hercare.backend.global.error.ProblemException;
import com.hercare.backend.modules.healthlog.application.HealthLogService;
import com.hercare.backend.modules.healthlog.domain.HealthLog;
import com.hercare.backend.modules.healthlog.infrastructure.persistence.HealthLogRepository;
import com.hercare.backend.modules.healthlog.presentation.dto.HealthLogRequest;
import com.hercare.backend.modules.healthlog.presentation.dto.HealthLogResponse;
import com.hercare.backend.modules.link.application.RecordAccessGuard;
import com.hercare.backend.modules.link.domain.ResourceCategory;
import com.hercare.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class HealthLogServiceTest {

    private static final UUID DOCTOR = UUID.fromString("00000000-0000-0000-0000-0000000000d1");
    private static final UUID PATIENT = UUID.fromString("00000000-0000-0000-0000-0000000000a1");

    @Mock
    private HealthLogRepository healthLogRepository;

    @Mock
    private RecordAccessGuard accessGuard;

    private HealthLogService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2026-03-01T09:00:00Z").toInstant(), ZoneOffset.UTC);
        service = new HealthLogService(healthLogRepository, accessGuard, clock);
    }

    private static HealthLog existingLog() {
        HealthLog log = new HealthLog();
        log.setPatientId(PATIENT);
        log.setLogType("symptom");
        log.setTitle("Cramps");
        log.setPainLevel(6);
        log.setLogDate(LocalDate.of(2026, 2, 27));
        return TestEntities.withId(log, UUID.randomUUID());
    }

    @Test
    void createFillsTypeTitleAndDate() {
        when(healthLogRepository.saveAndFlush(any(HealthLog.class))).thenAnswer(invocation -> invocation.getArgument(0));

        HealthLogResponse response = service.create(PATIENT, PATIENT,
                new HealthLogRequest(null, " ", null, null, 2, null, "calm", null));

        verify(accessGuard).checkWrite(PATIENT, PATIENT, ResourceCategory.HEALTH_LOGS);
        assertThat(response.logType()).isEqualTo("health_check");
        assertThat(response.title()).isEqualTo("health_check");
        assertThat(response.logDate()).isEqualTo(LocalDate.of(2026, 3, 1));
    }

    @Test
    void revokedDoctorCannotWrite() {
        doThrow(new ProblemException(HttpStatus.FORBIDDEN, "NOT_AUTHORIZED"))
                .when(accessGuard).checkWrite(DOCTOR, PATIENT, ResourceCategory.HEALTH_LOGS);

        assertThatThrownBy(() -> service.create(DOCTOR, PATIENT,
                new HealthLogRequest("symptom", "Nausea", null, null, null, null, null, null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("NOT_AUTHORIZED"));
        verify(healthLogRepository, never()).saveAndFlush(any());
    }

    @Test
    void updateKeepsOmittedFields() {
        HealthLog log = existingLog();
        when(healthLogRepository.findById(log.getId())).thenReturn(Optional.of(log));
        when(healthLogRepository.saveAndFlush(log)).thenReturn(log);

        HealthLogResponse response = service.update(PATIENT, log.getId(),
                new HealthLogRequest(null, null, null, null, 3, null, null, "better after rest"));

        verify(accessGuard).checkWrite(PATIENT, PATIENT, ResourceCategory.HEALTH_LOGS);
        assertThat(response.painLevel()).isEqualTo(3);
        assertThat(response.title()).isEqualTo("Cramps");
        assertThat(response.logDate()).isEqualTo(LocalDate.of(2026, 2, 27));
        assertThat(response.notes()).isEqualTo("better after rest");
    }

    @Test
    void unknownLogIsNotFoundBeforeAccessCheck() {
        UUID logId = UUID.randomUUID();
        when(healthLogRepository.findById(logId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.delete(DOCTOR, logId))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("HEALTH_LOG_NOT_FOUND");
                });
        verifyNoInteractions(accessGuard);
    }

    @Test
    void revokedDoctorCannotDeleteExistingLog() {
        HealthLog log = existingLog();
        when(healthLogRepository.findById(log.getId())).thenReturn(Optional.of(log));
        doThrow(new ProblemException(HttpStatus.FORBIDDEN, "NOT_AUTHORIZED"))
                .when(accessGuard).checkWrite(DOCTOR, PATIENT, ResourceCategory.HEALTH_LOGS);

        assertThatThrownBy(() -> service.delete(DOCTOR, log.getId())).isInstanceOf(ProblemException.class);
        verify(healthLogRepository, never()).delete(any());
    }

    @Test
    void noLogsIsEmptyList() {
        when(healthLogRepository.findByPatientId(PATIENT)).thenReturn(List.of());

        assertThat(service.list(DOCTOR, PATIENT)).isEmpty();
        verify(accessGuard).checkRead(DOCTOR, PATIENT, ResourceCategory.HEALTH_LOGS);
    }
}

package com.hercare.backend.modules.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.hercare.backend.global.error.ProblemException;
import com.hercare.backend.modules.link.application.RecordAccessGuard;
import com.hercare.backend.modules.link.domain.ResourceCategory;
import com.hercare.backend.modules.report.application.MedicalReportService;
import com.hercare.backend.modules.report.domain.MedicalReport;
import com.hercare.backend.modules.report.infrastructure.persistence.MedicalReportRepository;
import com.hercare.backend.modules.report.presentation.dto.CreateReportRequest;
import com.hercare.backend.modules.report.presentation.dto.ReportResponse;
import com.hercare.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class MedicalReportServiceTest {

    private static final UUID DOCTOR = UUID.fromString("00000000-0000-0000-0000-0000000000d1");
    private static final UUID PATIENT = UUID.fromString("00000000-0000-0000-0000-0000000000a1");

    @Mock
    private MedicalReportRepository reportRepository;

    @Mock
    private RecordAccessGuard accessGuard;

    private MedicalReportService service;

    @BeforeEach
    void setUp() {
        service = new MedicalReportService(reportRepository, accessGuard);
    }

    private static MedicalReport storedReport() {
        MedicalReport report = new MedicalReport();
        report.setPatientId(PATIENT);
        report.setUploadedBy(DOCTOR);
        report.setTitle("Ultrasound");
        report.setReportType("imaging");
        report.setFileName("scan.png");
        report.setFileData("aGVsbG8=");
        return TestEntities.withId(report, UUID.randomUUID());
    }

    @Test
    void uploadDefaultsReportTypeAndRecordsUploader() {
        when(reportRepository.saveAndFlush(any(MedicalReport.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ReportResponse response = service.create(DOCTOR, PATIENT,
                new CreateReportRequest(" Blood panel ", null, null, "panel.pdf", "cGRm"));

        verify(accessGuard).checkWrite(DOCTOR, PATIENT, ResourceCategory.REPORTS);
        assertThat(response.title()).isEqualTo("Blood panel");
        assertThat(response.reportType()).isEqualTo("other");
        assertThat(response.uploadedBy()).isEqualTo(DOCTOR);
        assertThat(response.fileData()).isNull();
    }

    @Test
    void listOmitsFileContentButDetailCarriesIt() {
        MedicalReport report = storedReport();
        when(reportRepository.findByPatientId(PATIENT)).thenReturn(List.of(report));
        when(reportRepository.findById(report.getId())).thenReturn(Optional.of(report));

        assertThat(service.list(PATIENT, PATIENT)).singleElement()
                .satisfies(summary -> assertThat(summary.fileData()).isNull());
        assertThat(service.get(PATIENT, report.getId()).fileData()).isEqualTo("aGVsbG8=");
    }

    @Test
    void revokedDoctorCannotDeleteReport() {
        MedicalReport report = storedReport();
        when(reportRepository.findById(report.getId())).thenReturn(Optional.of(report));
        doThrow(new ProblemException(HttpStatus.FORBIDDEN, "NOT_AUTHORIZED"))
                .when(accessGuard).checkWrite(DOCTOR, PATIENT, ResourceCategory.REPORTS);

        assertThatThrownBy(() -> service.delete(DOCTOR, report.getId()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN));
        verify(reportRepository, never()).delete(any());
    }

    @Test
    void unknownReportIsNotFoundBeforeAccessCheck() {
        UUID reportId = UUID.randomUUID();
        when(reportRepository.findById(reportId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.get(DOCTOR, reportId))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("REPORT_NOT_FOUND");
                });
        verifyNoInteractions(accessGuard);
    }

    @Test
    void noReportsIsEmptyList() {
        when(reportRepository.findByPatientId(PATIENT)).thenReturn(List.of());

        assertThat(service.list(DOCTOR, PATIENT)).isEmpty();
    }
}

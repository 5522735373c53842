package com.hercare.backend.modules.report.application;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.hercare.backend.global.error.ProblemException;
import com.hercare.backend.modules.link.application.RecordAccessGuard;
import com.hercare.backend.modules.link.domain.ResourceCategory;
import com.hercare.backend.modules.migration.application.OwnedRecordReassigner;
import com.hercare.backend.modules.report.domain.MedicalReport;
import com.hercare.backend.modules.report.infrastructure.persistence.MedicalReportRepository;
import com.hercare.backend.modules.report.presentation.dto.CreateReportRequest;
import com.hercare.backend.modules.report.presentation.dto.ReportResponse;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class MedicalReportService implements OwnedRecordReassigner {

    private static final String DEFAULT_REPORT_TYPE = "other";

    private final MedicalReportRepository reportRepository;
    private final RecordAccessGuard accessGuard;

    public MedicalReportService(MedicalReportRepository reportRepository, RecordAccessGuard accessGuard) {
        this.reportRepository = reportRepository;
        this.accessGuard = accessGuard;
    }

    public ReportResponse create(UUID requesterId, UUID patientId, CreateReportRequest request) {
        accessGuard.checkWrite(requesterId, patientId, ResourceCategory.REPORTS);

        MedicalReport report = new MedicalReport();
        report.setPatientId(patientId);
        report.setUploadedBy(requesterId);
        report.setTitle(request.title().trim());
        report.setReportType(request.reportType() != null && !request.reportType().isBlank()
                ? request.reportType()
                : DEFAULT_REPORT_TYPE);
        report.setNotes(request.notes());
        report.setFileName(request.fileName());
        report.setFileData(request.fileData());
        return ReportResponse.summary(reportRepository.saveAndFlush(report));
    }

    @Transactional(readOnly = true)
    public List<ReportResponse> list(UUID requesterId, UUID patientId) {
        accessGuard.checkRead(requesterId, patientId, ResourceCategory.REPORTS);
        return reportRepository.findByPatientId(patientId).stream()
                .map(ReportResponse::summary)
                .toList();
    }

    @Transactional(readOnly = true)
    public ReportResponse get(UUID requesterId, UUID reportId) {
        MedicalReport report = load(reportId);
        accessGuard.checkRead(requesterId, report.getPatientId(), ResourceCategory.REPORTS);
        return ReportResponse.detail(report);
    }

    public void delete(UUID requesterId, UUID reportId) {
        MedicalReport report = load(reportId);
        accessGuard.checkWrite(requesterId, report.getPatientId(), ResourceCategory.REPORTS);
        reportRepository.delete(report);
    }

    @Override
    public ResourceCategory category() {
        return ResourceCategory.REPORTS;
    }

    @Override
    public int reassign(UUID shadowPatientId, UUID realPatientId, OffsetDateTime now) {
        return reportRepository.reassignPatient(shadowPatientId, realPatientId, now);
    }

    private MedicalReport load(UUID reportId) {
        return reportRepository.findById(reportId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "REPORT_NOT_FOUND"));
    }
}

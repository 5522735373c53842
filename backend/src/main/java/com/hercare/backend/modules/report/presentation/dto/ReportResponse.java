package com.hercare.backend.modules.report.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.hercare.backend.modules.report.domain.MedicalReport;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportResponse(
        UUID id,
        UUID patientId,
        UUID uploadedBy,
        String title,
        String reportType,
        String notes,
        String fileName,
        String fileData,
        OffsetDateTime createdAt
) {
    public static ReportResponse summary(MedicalReport report) {
        return of(report, null);
    }

    public static ReportResponse detail(MedicalReport report) {
        return of(report, report.getFileData());
    }

    private static ReportResponse of(MedicalReport report, String fileData) {
        return new ReportResponse(
                report.getId(),
                report.getPatientId(),
                report.getUploadedBy(),
                report.getTitle(),
                report.getReportType(),
                report.getNotes(),
                report.getFileName(),
                fileData,
                report.getCreatedAt()
        );
    }
}

package com.hercare.backend.modules.report.presentation;

import java.util.List;
import java.util.UUID;

import com.hercare.backend.global.security.SecurityUtils;
import com.hercare.backend.modules.report.application.MedicalReportService;
import com.hercare.backend.modules.report.presentation.dto.CreateReportRequest;
import com.hercare.backend.modules.report.presentation.dto.ReportResponse;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MedicalReportController {

    private final MedicalReportService reportService;

    public MedicalReportController(MedicalReportService reportService) {
        this.reportService = reportService;
    }

    @PostMapping("/patients/{patientId}/reports")
    public ResponseEntity<ReportResponse> create(
            @PathVariable UUID patientId,
            @Valid @RequestBody CreateReportRequest request
    ) {
        ReportResponse response = reportService.create(SecurityUtils.getCurrentUserId(), patientId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/patients/{patientId}/reports")
    public ResponseEntity<List<ReportResponse>> list(@PathVariable UUID patientId) {
        return ResponseEntity.ok(reportService.list(SecurityUtils.getCurrentUserId(), patientId));
    }

    @GetMapping("/reports/{reportId}")
    public ResponseEntity<ReportResponse> get(@PathVariable UUID reportId) {
        return ResponseEntity.ok(reportService.get(SecurityUtils.getCurrentUserId(), reportId));
    }

    @DeleteMapping("/reports/{reportId}")
    public ResponseEntity<Void> delete(@PathVariable UUID reportId) {
        reportService.delete(SecurityUtils.getCurrentUserId(), reportId);
        return ResponseEntity.noContent().build();
    }
}

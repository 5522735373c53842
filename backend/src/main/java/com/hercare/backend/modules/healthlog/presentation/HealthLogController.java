package com.hercare.backend.modules.healthlog.presentation;

import java.util.List;
import java.util.UUID;

import com.hercare.backend.global.security.SecurityUtils;
import com.hercare.backend.modules.healthlog.application.HealthLogService;
import com.hercare.backend.modules.healthlog.presentation.dto.HealthLogRequest;
import com.hercare.backend.modules.healthlog.presentation.dto.HealthLogResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthLogController {

    private final HealthLogService healthLogService;

    public HealthLogController(HealthLogService healthLogService) {
        this.healthLogService = healthLogService;
    }

    @PostMapping("/patients/{patientId}/health-logs")
    public ResponseEntity<HealthLogResponse> create(
            @PathVariable UUID patientId,
            @Valid @RequestBody HealthLogRequest request
    ) {
        HealthLogResponse response = healthLogService.create(SecurityUtils.getCurrentUserId(), patientId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "건강 기록 조회 (본인 또는 권한 있는 연결 의사)")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "log_date 내림차순 목록"),
            @ApiResponse(responseCode = "403", description = "NOT_LINKED / NOT_AUTHORIZED"),
            @ApiResponse(responseCode = "404", description = "PATIENT_NOT_FOUND")
    })
    @GetMapping("/patients/{patientId}/health-logs")
    public ResponseEntity<List<HealthLogResponse>> list(@PathVariable UUID patientId) {
        return ResponseEntity.ok(healthLogService.list(SecurityUtils.getCurrentUserId(), patientId));
    }

    @PutMapping("/health-logs/{logId}")
    public ResponseEntity<HealthLogResponse> update(
            @PathVariable UUID logId,
            @Valid @RequestBody HealthLogRequest request
    ) {
        return ResponseEntity.ok(healthLogService.update(SecurityUtils.getCurrentUserId(), logId, request));
    }

    @DeleteMapping("/health-logs/{logId}")
    public ResponseEntity<Void> delete(@PathVariable UUID logId) {
        healthLogService.delete(SecurityUtils.getCurrentUserId(), logId);
        return ResponseEntity.noContent().build();
    }
}

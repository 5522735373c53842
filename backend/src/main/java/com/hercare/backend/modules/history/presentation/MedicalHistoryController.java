package com.hercare.backend.modules.history.presentation;

import java.util.UUID;

import com.hercare.backend.global.security.SecurityUtils;
import com.hercare.backend.modules.history.application.MedicalHistoryService;
import com.hercare.backend.modules.history.presentation.dto.MedicalHistoryRequest;
import com.hercare.backend.modules.history.presentation.dto.MedicalHistoryResponse;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/patients/{patientId}/medical-history")
public class MedicalHistoryController {

    private final MedicalHistoryService historyService;

    public MedicalHistoryController(MedicalHistoryService historyService) {
        this.historyService = historyService;
    }

    // 204 when the patient has no history yet
    @GetMapping
    public ResponseEntity<MedicalHistoryResponse> get(@PathVariable UUID patientId) {
        return historyService.get(SecurityUtils.getCurrentUserId(), patientId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PutMapping
    public ResponseEntity<MedicalHistoryResponse> upsert(
            @PathVariable UUID patientId,
            @Valid @RequestBody MedicalHistoryRequest request
    ) {
        return ResponseEntity.ok(historyService.upsert(SecurityUtils.getCurrentUserId(), patientId, request));
    }
}

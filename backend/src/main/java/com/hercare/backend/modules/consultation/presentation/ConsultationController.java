package com.hercare.backend.modules.consultation.presentation;

import java.util.List;
import java.util.UUID;

import com.hercare.backend.global.security.RequiresRole;
import com.hercare.backend.global.security.SecurityUtils;
import com.hercare.backend.modules.auth.domain.UserRole;
import com.hercare.backend.modules.consultation.application.ConsultationService;
import com.hercare.backend.modules.consultation.presentation.dto.ConsultationResponse;
import com.hercare.backend.modules.consultation.presentation.dto.CreateConsultationRequest;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ConsultationController {

    private final ConsultationService consultationService;

    public ConsultationController(ConsultationService consultationService) {
        this.consultationService = consultationService;
    }

    @RequiresRole(UserRole.DOCTOR)
    @PostMapping("/patients/{patientId}/consultations")
    public ResponseEntity<ConsultationResponse> create(
            @PathVariable UUID patientId,
            @Valid @RequestBody CreateConsultationRequest request
    ) {
        ConsultationResponse response = consultationService.create(SecurityUtils.getCurrentUserId(), patientId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/patients/{patientId}/consultations")
    public ResponseEntity<List<ConsultationResponse>> list(@PathVariable UUID patientId) {
        return ResponseEntity.ok(consultationService.list(SecurityUtils.getCurrentUserId(), patientId));
    }

    @PutMapping("/consultations/{consultationId}/pay")
    public ResponseEntity<ConsultationResponse> pay(@PathVariable UUID consultationId) {
        return ResponseEntity.ok(consultationService.markPaid(SecurityUtils.getCurrentUserId(), consultationId));
    }
}

package com.hercare.backend.modules.medication.presentation;

import java.util.List;
import java.util.UUID;

import com.hercare.backend.global.security.SecurityUtils;
import com.hercare.backend.modules.medication.application.MedicationService;
import com.hercare.backend.modules.medication.presentation.dto.CreateMedicationRequest;
import com.hercare.backend.modules.medication.presentation.dto.MedicationResponse;
import com.hercare.backend.modules.medication.presentation.dto.UpdateMedicationRequest;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MedicationController {

    private final MedicationService medicationService;

    public MedicationController(MedicationService medicationService) {
        this.medicationService = medicationService;
    }

    @PostMapping("/patients/{patientId}/medications")
    public ResponseEntity<MedicationResponse> create(
            @PathVariable UUID patientId,
            @Valid @RequestBody CreateMedicationRequest request
    ) {
        MedicationResponse response = medicationService.create(SecurityUtils.getCurrentUserId(), patientId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/patients/{patientId}/medications")
    public ResponseEntity<List<MedicationResponse>> list(
            @PathVariable UUID patientId,
            @RequestParam(name = "includeInactive", defaultValue = "false") boolean includeInactive
    ) {
        return ResponseEntity.ok(medicationService.list(SecurityUtils.getCurrentUserId(), patientId, includeInactive));
    }

    @PutMapping("/medications/{medicationId}")
    public ResponseEntity<MedicationResponse> update(
            @PathVariable UUID medicationId,
            @Valid @RequestBody UpdateMedicationRequest request
    ) {
        return ResponseEntity.ok(medicationService.update(SecurityUtils.getCurrentUserId(), medicationId, request));
    }

    @PostMapping("/medications/{medicationId}/deactivate")
    public ResponseEntity<MedicationResponse> deactivate(@PathVariable UUID medicationId) {
        return ResponseEntity.ok(medicationService.deactivate(SecurityUtils.getCurrentUserId(), medicationId));
    }

    @DeleteMapping("/medications/{medicationId}")
    public ResponseEntity<Void> delete(@PathVariable UUID medicationId) {
        medicationService.delete(SecurityUtils.getCurrentUserId(), medicationId);
        return ResponseEntity.noContent().build();
    }
}

package com.hercare.backend.modules.dietplan.presentation;

import java.util.List;
import java.util.UUID;

import com.hercare.backend.global.security.SecurityUtils;
import com.hercare.backend.modules.dietplan.application.DietPlanService;
import com.hercare.backend.modules.dietplan.presentation.dto.DietPlanRequest;
import com.hercare.backend.modules.dietplan.presentation.dto.DietPlanResponse;

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
public class DietPlanController {

    private final DietPlanService dietPlanService;

    public DietPlanController(DietPlanService dietPlanService) {
        this.dietPlanService = dietPlanService;
    }

    @PostMapping("/patients/{patientId}/diet-plans")
    public ResponseEntity<DietPlanResponse> create(
            @PathVariable UUID patientId,
            @Valid @RequestBody DietPlanRequest request
    ) {
        DietPlanResponse response = dietPlanService.create(SecurityUtils.getCurrentUserId(), patientId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/patients/{patientId}/diet-plans")
    public ResponseEntity<List<DietPlanResponse>> list(@PathVariable UUID patientId) {
        return ResponseEntity.ok(dietPlanService.list(SecurityUtils.getCurrentUserId(), patientId));
    }

    @PutMapping("/diet-plans/{planId}")
    public ResponseEntity<DietPlanResponse> update(
            @PathVariable UUID planId,
            @Valid @RequestBody DietPlanRequest request
    ) {
        return ResponseEntity.ok(dietPlanService.update(SecurityUtils.getCurrentUserId(), planId, request));
    }

    @DeleteMapping("/diet-plans/{planId}")
    public ResponseEntity<Void> delete(@PathVariable UUID planId) {
        dietPlanService.delete(SecurityUtils.getCurrentUserId(), planId);
        return ResponseEntity.noContent().build();
    }
}

package com.hercare.backend.modules.link.presentation;

import java.util.List;

import com.hercare.backend.global.security.RequiresRole;
import com.hercare.backend.global.security.SecurityUtils;
import com.hercare.backend.modules.auth.domain.UserRole;
import com.hercare.backend.modules.link.application.LinkRegistryService;
import com.hercare.backend.modules.link.application.PatientRegistrationService;
import com.hercare.backend.modules.link.presentation.dto.LinkedPatientResponse;
import com.hercare.backend.modules.link.presentation.dto.RegisterPatientRequest;
import com.hercare.backend.modules.link.presentation.dto.RegisteredPatientResponse;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/doctor/patients")
@RequiresRole(UserRole.DOCTOR)
public class DoctorPatientController {

    private final PatientRegistrationService patientRegistrationService;
    private final LinkRegistryService linkRegistryService;

    public DoctorPatientController(
            PatientRegistrationService patientRegistrationService,
            LinkRegistryService linkRegistryService
    ) {
        this.patientRegistrationService = patientRegistrationService;
        this.linkRegistryService = linkRegistryService;
    }

    @Operation(summary = "환자 등록 (이메일 없으면 섀도 환자 + 공유 코드)")
    @PostMapping
    public ResponseEntity<RegisteredPatientResponse> registerPatient(@Valid @RequestBody RegisterPatientRequest request) {
        RegisteredPatientResponse response = patientRegistrationService.registerPatient(SecurityUtils.getCurrentUserId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<LinkedPatientResponse>> myPatients() {
        return ResponseEntity.ok(linkRegistryService.listMyPatients(SecurityUtils.getCurrentUserId()));
    }
}

package com.hercare.backend.modules.doctor.presentation;

import java.util.UUID;

import com.hercare.backend.global.security.RequiresRole;
import com.hercare.backend.global.security.SecurityUtils;
import com.hercare.backend.modules.auth.domain.UserRole;
import com.hercare.backend.modules.doctor.application.DoctorProfileService;
import com.hercare.backend.modules.doctor.presentation.dto.CreateDoctorProfileRequest;
import com.hercare.backend.modules.doctor.presentation.dto.DoctorProfileResponse;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/doctor-profiles")
public class DoctorProfileController {

    private final DoctorProfileService doctorProfileService;

    public DoctorProfileController(DoctorProfileService doctorProfileService) {
        this.doctorProfileService = doctorProfileService;
    }

    @RequiresRole(UserRole.DOCTOR)
    @PostMapping
    public ResponseEntity<DoctorProfileResponse> createProfile(@Valid @RequestBody CreateDoctorProfileRequest request) {
        DoctorProfileResponse response = doctorProfileService.createProfile(SecurityUtils.getCurrentUserId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @RequiresRole(UserRole.DOCTOR)
    @GetMapping("/me")
    public ResponseEntity<DoctorProfileResponse> getMyProfile() {
        UUID doctorId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(doctorProfileService.getProfile(doctorId, doctorId));
    }

    @GetMapping("/{doctorId}")
    public ResponseEntity<DoctorProfileResponse> getProfile(@PathVariable UUID doctorId) {
        return ResponseEntity.ok(doctorProfileService.getProfile(doctorId, SecurityUtils.getCurrentUserId()));
    }
}
